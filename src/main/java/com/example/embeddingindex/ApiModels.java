package com.example.embeddingindex;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Request and response bodies of the REST API. Field names are rendered in
 * snake_case by the configured Jackson naming strategy.
 */
public class ApiModels {

    public static class ItemInfo {
        private String projectId;
        private String itemId;
        private String contentType;
        private String originalFilename;
        private long sizeBytes;

        public static ItemInfo of(StoredItem item) {
            ItemInfo info = new ItemInfo();
            info.setProjectId(item.getProjectId());
            info.setItemId(item.getItemId());
            info.setContentType(item.getContentType());
            info.setOriginalFilename(item.getOriginalFilename());
            info.setSizeBytes(item.getSizeBytes());
            return info;
        }

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }
        public String getItemId() { return itemId; }
        public void setItemId(String itemId) { this.itemId = itemId; }
        public String getContentType() { return contentType; }
        public void setContentType(String contentType) { this.contentType = contentType; }
        public String getOriginalFilename() { return originalFilename; }
        public void setOriginalFilename(String originalFilename) { this.originalFilename = originalFilename; }
        public long getSizeBytes() { return sizeBytes; }
        public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
    }

    public static class ItemList {
        private List<ItemInfo> items;

        public static ItemList of(List<StoredItem> items) {
            ItemList list = new ItemList();
            list.setItems(items.stream().map(ItemInfo::of).collect(Collectors.toList()));
            return list;
        }

        public List<ItemInfo> getItems() { return items; }
        public void setItems(List<ItemInfo> items) { this.items = items; }
    }

    public static class SearchRequest {
        private String query;
        private Integer limit;   // optional, defaults to 5

        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public Integer getLimit() { return limit; }
        public void setLimit(Integer limit) { this.limit = limit; }
    }

    public static class SearchResult {
        private ItemInfo item;
        private double similarity;

        public ItemInfo getItem() { return item; }
        public void setItem(ItemInfo item) { this.item = item; }
        public double getSimilarity() { return similarity; }
        public void setSimilarity(double similarity) { this.similarity = similarity; }
    }

    public static class SearchResponse {
        private List<SearchResult> results;

        public static SearchResponse of(List<SearchHit> hits) {
            SearchResponse resp = new SearchResponse();
            resp.setResults(hits.stream().map(h -> {
                SearchResult r = new SearchResult();
                r.setItem(ItemInfo.of(h.getItem()));
                r.setSimilarity(h.getSimilarity());
                return r;
            }).collect(Collectors.toList()));
            return resp;
        }

        public List<SearchResult> getResults() { return results; }
        public void setResults(List<SearchResult> results) { this.results = results; }
    }

    public static class ErrorBody {
        private String code;
        private String message;

        public ErrorBody() {}

        public ErrorBody(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }

    public static class ErrorResponse {
        private ErrorBody error;

        public ErrorResponse() {}

        public ErrorResponse(String code, String message) {
            this.error = new ErrorBody(code, message);
        }

        public ErrorBody getError() { return error; }
        public void setError(ErrorBody error) { this.error = error; }
    }
}
