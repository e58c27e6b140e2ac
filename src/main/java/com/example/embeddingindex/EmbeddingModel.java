package com.example.embeddingindex;

/**
 * External embedding function. Implementations may be slow and GPU bound;
 * callers go through {@link EmbeddingGateway} so the concurrency gate applies.
 */
public interface EmbeddingModel {

    float[] embedText(String text) throws InferenceException;

    float[] embedImage(byte[] image, String contentType) throws InferenceException;
}
