package com.example.embeddingindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs every embedding call inside one slot of the embedding gate. The store
 * lock is never held here.
 */
@Slf4j
@Service
public class EmbeddingGateway {

    static final String PROBE_TEXT = "dimension probe";

    private final EmbeddingModel model;
    private final ConcurrencyGate gate;
    private final String resource;
    private final Duration acquireTimeout;

    private volatile int dimension = -1;

    public EmbeddingGateway(EmbeddingModel model, ConcurrencyGate gate, EmbeddingIndexProperties props) {
        this.model = model;
        this.gate = gate;
        this.resource = props.getGate().getEmbeddingResource();
        this.acquireTimeout = props.getGate().getAcquireTimeout();
    }

    public float[] embedText(String text) {
        return gated("text", () -> model.embedText(text));
    }

    public float[] embedImage(byte[] image, String contentType) {
        return gated("image", () -> model.embedImage(image, contentType));
    }

    /**
     * Embedding dimension, taken once from a probe call and cached.
     */
    public int probeDimension() {
        int d = dimension;
        if (d > 0) return d;
        synchronized (this) {
            if (dimension < 1) {
                dimension = embedText(PROBE_TEXT).length;
                log.info("Probed embedding dimension: {}", dimension);
            }
            return dimension;
        }
    }

    private float[] gated(String kind, Supplier<float[]> call) {
        try (ConcurrencyGate.Permit ignored = acquire()) {
            float[] v;
            try {
                v = call.get();
            } catch (EmbeddingIndexException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InferenceException("Embedding model failed on " + kind + " input", e);
            }
            if (v == null || v.length == 0) {
                throw new InferenceException("Embedding model returned no vector for " + kind + " input");
            }
            return v;
        }
    }

    private ConcurrencyGate.Permit acquire() {
        try {
            if (acquireTimeout == null || acquireTimeout.isZero() || acquireTimeout.isNegative()) {
                return gate.acquire(resource);
            }
            return gate.tryAcquire(resource, acquireTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for the '" + resource + "' gate", e);
        }
    }
}
