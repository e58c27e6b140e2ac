package com.example.embeddingindex;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EmbeddingGatewayTest {

    private static EmbeddingIndexProperties props(Duration timeout) {
        EmbeddingIndexProperties p = new EmbeddingIndexProperties();
        p.getGate().setAcquireTimeout(timeout);
        return p;
    }

    private static ConcurrencyGate gate() {
        ConcurrencyGate g = new ConcurrencyGate();
        g.register("embedding", 1);
        return g;
    }

    @Test
    public void callsRunInsideAPermitAndReleaseIt() {
        EmbeddingModel model = Mockito.mock(EmbeddingModel.class);
        ConcurrencyGate gate = gate();
        when(model.embedText("hi")).thenAnswer(inv -> {
            assertThat(gate.available("embedding")).isZero();
            return new float[]{1f, 2f};
        });
        EmbeddingGateway gw = new EmbeddingGateway(model, gate, props(null));

        assertThat(gw.embedText("hi")).containsExactly(1f, 2f);
        assertThat(gate.available("embedding")).isEqualTo(1);
    }

    @Test
    public void probeIsCached() {
        EmbeddingModel model = Mockito.mock(EmbeddingModel.class);
        when(model.embedText(anyString())).thenReturn(new float[3]);
        EmbeddingGateway gw = new EmbeddingGateway(model, gate(), props(null));

        assertThat(gw.probeDimension()).isEqualTo(3);
        assertThat(gw.probeDimension()).isEqualTo(3);
        verify(model, times(1)).embedText(EmbeddingGateway.PROBE_TEXT);
    }

    @Test
    public void timeoutAppliesWhenTheSlotIsBusy() throws Exception {
        EmbeddingModel model = Mockito.mock(EmbeddingModel.class);
        ConcurrencyGate gate = gate();
        EmbeddingGateway gw = new EmbeddingGateway(model, gate, props(Duration.ofMillis(50)));

        try (ConcurrencyGate.Permit held = gate.acquire("embedding")) {
            assertThatThrownBy(() -> gw.embedText("x")).isInstanceOf(GateExhaustedException.class);
        }
        Mockito.verifyNoInteractions(model);
    }

    @Test
    public void modelFailuresBecomeInferenceErrorsAndReleaseThePermit() {
        EmbeddingModel model = Mockito.mock(EmbeddingModel.class);
        ConcurrencyGate gate = gate();
        when(model.embedImage(Mockito.any(), anyString())).thenThrow(new IllegalStateException("boom"));
        when(model.embedText("empty")).thenReturn(new float[0]);
        EmbeddingGateway gw = new EmbeddingGateway(model, gate, props(null));

        assertThatThrownBy(() -> gw.embedImage(new byte[]{1}, "image/png"))
                .isInstanceOf(InferenceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> gw.embedText("empty")).isInstanceOf(InferenceException.class);
        assertThat(gate.available("embedding")).isEqualTo(1);
    }
}
