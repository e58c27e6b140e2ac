package com.example.embeddingindex;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Ledger encoding of embeddings: D little-endian 32-bit floats, no header.
 */
public final class VectorCodec {

    private VectorCodec() {}

    public static byte[] encode(float[] vector) {
        ByteBuffer buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float f : vector) buf.putFloat(f);
        return buf.array();
    }

    public static float[] decode(byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("embedding blob length " + bytes.length + " is not a multiple of 4");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < out.length; i++) out[i] = buf.getFloat();
        return out;
    }

    /**
     * Rejects vectors that cosine similarity cannot handle.
     */
    public static void requireUsable(float[] vector) {
        double norm = 0;
        for (float f : vector) {
            if (Float.isNaN(f) || Float.isInfinite(f)) {
                throw new InvalidRequestException("INVALID_EMBEDDING", "embedding contains NaN or infinite components");
            }
            norm += (double) f * f;
        }
        if (norm == 0) {
            throw new InvalidRequestException("INVALID_EMBEDDING", "embedding has zero norm");
        }
    }

    public static double cosine(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return -1.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
