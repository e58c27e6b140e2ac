package com.example.embeddingindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/items")
public class ItemController {

    private static final Logger log = LoggerFactory.getLogger(ItemController.class);

    private final ItemService items;

    public ItemController(ItemService items) {
        this.items = items;
    }

    @PostMapping(consumes = "multipart/form-data")
    public ApiModels.ItemInfo upload(@PathVariable String projectId,
                                     @RequestParam("file") MultipartFile file) throws IOException {
        log.info("Upload to project {}: {} ({} bytes, {})", projectId, file.getOriginalFilename(),
                file.getSize(), file.getContentType());
        StoredItem stored = items.registerItem(projectId, file.getBytes(), file.getContentType(),
                file.getOriginalFilename());
        return ApiModels.ItemInfo.of(stored);
    }

    @GetMapping
    public ApiModels.ItemList list(@PathVariable String projectId) {
        return ApiModels.ItemList.of(items.listItems(projectId));
    }

    @GetMapping("/{itemId}")
    public ApiModels.ItemInfo get(@PathVariable String projectId, @PathVariable String itemId) {
        return ApiModels.ItemInfo.of(items.getItem(projectId, itemId));
    }

    @DeleteMapping("/{itemId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String projectId, @PathVariable String itemId) {
        items.deleteItem(projectId, itemId);
    }

    @PostMapping("/search")
    public ApiModels.SearchResponse search(@PathVariable String projectId,
                                           @RequestBody ApiModels.SearchRequest req) {
        log.debug("Search in project {}: limit={}", projectId, req.getLimit());
        List<SearchHit> hits = items.searchText(projectId, req.getQuery(), req.getLimit());
        return ApiModels.SearchResponse.of(hits);
    }

    @GetMapping("/{itemId}/file")
    public ResponseEntity<Void> file(@PathVariable String projectId, @PathVariable String itemId) {
        URI url = items.presignedUrl(projectId, itemId);
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT).location(url).build();
    }
}
