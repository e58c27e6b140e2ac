package com.example.embeddingindex;

/**
 * The requested gate was never registered. This is a wiring bug, not backpressure.
 */
public class GateMisconfiguredException extends EmbeddingIndexException {

    public GateMisconfiguredException(String resource) {
        super("GATE_MISCONFIGURED", "No concurrency gate registered for '" + resource + "'");
    }
}
