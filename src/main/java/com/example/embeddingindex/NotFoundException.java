package com.example.embeddingindex;

/**
 * Thrown when a project, item or stored object does not exist.
 */
public class NotFoundException extends EmbeddingIndexException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }

    public static NotFoundException project(String projectId) {
        return new NotFoundException("PROJECT_NOT_FOUND", "Project not found: " + projectId);
    }

    public static NotFoundException item(String projectId, String itemId) {
        return new NotFoundException("ITEM_NOT_FOUND", "Item not found: " + projectId + "/" + itemId);
    }

    public static NotFoundException object(String key) {
        return new NotFoundException("OBJECT_NOT_FOUND", "Object not found: " + key);
    }
}
