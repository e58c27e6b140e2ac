package com.example.embeddingindex;

import java.time.Duration;

/**
 * No gate slot became free before the caller's deadline. Only raised by
 * {@link ConcurrencyGate#tryAcquire(String, Duration)}; plain acquires wait.
 */
public class GateExhaustedException extends EmbeddingIndexException {

    public GateExhaustedException(String resource, Duration timeout) {
        super("GATE_EXHAUSTED", "No free slot for '" + resource + "' within " + timeout.toMillis() + " ms");
    }
}
