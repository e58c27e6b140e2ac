package com.example.embeddingindex;

import java.util.regex.Pattern;

public final class Identifiers {

    // URL and DB friendly
    static final Pattern PROJECT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$");

    static final int MAX_ITEM_ID_LENGTH = 255;

    private Identifiers() {}

    public static String requireProjectId(String projectId) {
        String p = projectId == null ? "" : projectId;
        if (p.isEmpty()) {
            throw new InvalidRequestException("INVALID_PROJECT", "project_id is required");
        }
        if (!PROJECT_ID.matcher(p).matches()) {
            throw new InvalidRequestException("INVALID_PROJECT", "Invalid project_id format: " + p);
        }
        return p;
    }

    public static String requireItemId(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            throw new InvalidRequestException("INVALID_ID", "item id is required");
        }
        if (itemId.length() > MAX_ITEM_ID_LENGTH) {
            throw new InvalidRequestException("INVALID_ID", "item id is too long");
        }
        for (int i = 0; i < itemId.length(); i++) {
            if (Character.isISOControl(itemId.charAt(i))) {
                throw new InvalidRequestException("INVALID_ID", "item id contains control characters");
            }
        }
        return itemId;
    }
}
