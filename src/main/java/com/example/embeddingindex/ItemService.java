package com.example.embeddingindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Upload, search and removal of items: blob storage, embedding and the store
 * in the right order. The blob is written first and deleted again if the item
 * never makes it into the store.
 */
@Slf4j
@Service
public class ItemService {

    static final int MAX_QUERY_LENGTH = 2000;
    static final int MAX_LIMIT = 100;
    static final int DEFAULT_LIMIT = 5;

    private static final Pattern SAFE_SUFFIX = Pattern.compile("^\\.[A-Za-z0-9]{1,10}$");

    private final RecordStore store;
    private final ScopedSearch search;
    private final EmbeddingGateway embeddings;
    private final ObjectStorage storage;
    private final long maxBytes;
    private final Duration presignTtl;

    public ItemService(RecordStore store, ScopedSearch search, EmbeddingGateway embeddings,
                       ObjectStorage storage, EmbeddingIndexProperties props) {
        this.store = store;
        this.search = search;
        this.embeddings = embeddings;
        this.storage = storage;
        this.maxBytes = props.getUpload().getMaxBytes();
        this.presignTtl = props.getUpload().getPresignTtl();
    }

    public StoredItem registerItem(String projectId, byte[] data, String contentType, String originalFilename) {
        String p = Identifiers.requireProjectId(projectId);
        if (data == null || data.length == 0) {
            throw new InvalidRequestException("EMPTY_FILE", "Uploaded file is empty");
        }
        if (data.length > maxBytes) {
            throw new InvalidRequestException("FILE_TOO_LARGE", "File exceeds " + maxBytes + " bytes");
        }
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new InvalidRequestException("UNSUPPORTED_MEDIA_TYPE", "Only image/* uploads are accepted");
        }

        String itemId = UUID.randomUUID().toString();
        String key = "items/" + p + "/" + itemId + suffix(originalFilename, contentType);
        storage.put(key, data, contentType);
        try {
            float[] vector = embeddings.embedImage(data, contentType);
            StoredItem stored = store.upsertItem(
                    new StoredItem(p, itemId, key, contentType, originalFilename, data.length), vector);
            log.info("Registered item {}/{} ({} bytes)", p, itemId, data.length);
            return stored;
        } catch (RuntimeException e) {
            deleteBlobQuietly(key);
            throw e;
        }
    }

    public List<SearchHit> searchText(String projectId, String query, Integer limit) {
        String p = Identifiers.requireProjectId(projectId);
        if (query == null || query.isBlank() || query.length() > MAX_QUERY_LENGTH) {
            throw new InvalidRequestException("INVALID_QUERY", "query must be 1-" + MAX_QUERY_LENGTH + " characters");
        }
        int k = limit == null ? DEFAULT_LIMIT : limit;
        if (k < 1 || k > MAX_LIMIT) {
            throw new InvalidRequestException("INVALID_LIMIT", "limit must be 1-" + MAX_LIMIT);
        }
        if (!store.projectExists(p)) throw NotFoundException.project(p);
        float[] vector = embeddings.embedText(query);
        return search.search(p, vector, k);
    }

    public List<StoredItem> listItems(String projectId) {
        String p = Identifiers.requireProjectId(projectId);
        if (!store.projectExists(p)) throw NotFoundException.project(p);
        return store.listRecords(p);
    }

    public StoredItem getItem(String projectId, String itemId) {
        String p = Identifiers.requireProjectId(projectId);
        String i = Identifiers.requireItemId(itemId);
        return store.getRecord(p, i).orElseThrow(() -> NotFoundException.item(p, i));
    }

    public void deleteItem(String projectId, String itemId) {
        StoredItem existing = getItem(projectId, itemId);
        if (!store.deleteItem(existing.getProjectId(), existing.getItemId())) {
            throw NotFoundException.item(existing.getProjectId(), existing.getItemId());
        }
        deleteBlobQuietly(existing.getBlobKey());
        log.info("Deleted item {}/{}", existing.getProjectId(), existing.getItemId());
    }

    public URI presignedUrl(String projectId, String itemId) {
        StoredItem item = getItem(projectId, itemId);
        return storage.presignedUrl(item.getBlobKey(), presignTtl);
    }

    private void deleteBlobQuietly(String key) {
        try {
            storage.delete(key);
        } catch (RuntimeException e) {
            log.warn("Could not delete blob {}: {}", key, e.getMessage());
        }
    }

    static String suffix(String originalFilename, String contentType) {
        if (originalFilename != null) {
            int dot = originalFilename.lastIndexOf('.');
            if (dot >= 0) {
                String s = originalFilename.substring(dot).toLowerCase(Locale.ROOT);
                if (SAFE_SUFFIX.matcher(s).matches()) return s;
            }
        }
        String sub = contentType.substring(contentType.indexOf('/') + 1).toLowerCase(Locale.ROOT);
        int semi = sub.indexOf(';');
        if (semi >= 0) sub = sub.substring(0, semi).trim();
        if ("jpeg".equals(sub)) sub = "jpg";
        String s = "." + sub;
        return SAFE_SUFFIX.matcher(s).matches() ? s : "";
    }
}
