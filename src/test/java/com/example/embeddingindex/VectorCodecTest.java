package com.example.embeddingindex;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class VectorCodecTest {

    @Test
    public void encodesLittleEndianWithoutHeader() {
        byte[] bytes = VectorCodec.encode(new float[]{1.0f});
        // 1.0f = 0x3F800000
        assertThat(bytes).containsExactly(0x00, 0x00, (byte) 0x80, 0x3F);
        assertThat(VectorCodec.decode(VectorCodec.encode(new float[]{0.25f, -3f}))).containsExactly(0.25f, -3f);
    }

    @Test
    public void decodeRejectsTruncatedBlob() {
        assertThatThrownBy(() -> VectorCodec.decode(new byte[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void rejectsZeroAndNonFiniteVectors() {
        assertThatThrownBy(() -> VectorCodec.requireUsable(new float[]{0f, 0f}))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("code").isEqualTo("INVALID_EMBEDDING");
        assertThatThrownBy(() -> VectorCodec.requireUsable(new float[]{Float.NaN, 1f}))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> VectorCodec.requireUsable(new float[]{Float.POSITIVE_INFINITY}))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    public void cosineMatchesWorkedExample() {
        assertThat(VectorCodec.cosine(new float[]{1f, 0f}, new float[]{0.9f, 0.1f})).isCloseTo(0.9939, within(1e-3));
        assertThat(VectorCodec.cosine(new float[]{0f, 0f}, new float[]{1f, 0f})).isEqualTo(-1.0);
    }
}
