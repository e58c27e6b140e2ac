package com.example.embeddingindex;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConcurrencyGateTest {

    @Test
    public void singleSlotNeverAdmitsTwoHolders() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate();
        gate.register("embedding", 1);
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < 20; i++) {
                    try (ConcurrencyGate.Permit p = gate.acquire("embedding")) {
                        int now = holders.incrementAndGet();
                        maxSeen.accumulateAndGet(now, Math::max);
                        Thread.sleep(1);
                        holders.decrementAndGet();
                    }
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(maxSeen.get()).isEqualTo(1);
        assertThat(gate.available("embedding")).isEqualTo(1);
    }

    @Test
    public void permitReleasesExactlyOnce() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate();
        gate.register("gpu", 2);
        ConcurrencyGate.Permit p = gate.acquire("gpu");
        assertThat(gate.available("gpu")).isEqualTo(1);
        p.close();
        p.close();
        assertThat(gate.available("gpu")).isEqualTo(2);
        assertThat(gate.capacity("gpu")).isEqualTo(2);
    }

    @Test
    public void timeoutRaisesExhaustedAndUnknownNameRaisesMisconfigured() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate();
        gate.register("embedding", 1);
        try (ConcurrencyGate.Permit held = gate.acquire("embedding")) {
            assertThatThrownBy(() -> gate.tryAcquire("embedding", Duration.ofMillis(50)))
                    .isInstanceOf(GateExhaustedException.class);
        }
        try (ConcurrencyGate.Permit again = gate.tryAcquire("embedding", Duration.ofMillis(50))) {
            assertThat(gate.available("embedding")).isZero();
        }
        assertThatThrownBy(() -> gate.acquire("nope")).isInstanceOf(GateMisconfiguredException.class);
        assertThat(gate.isRegistered("nope")).isFalse();
    }

    @Test
    public void registrationErrors() {
        ConcurrencyGate gate = new ConcurrencyGate();
        assertThatThrownBy(() -> gate.register("x", 0)).isInstanceOf(IllegalArgumentException.class);
        gate.register("x", 1);
        assertThatThrownBy(() -> gate.register("x", 1)).isInstanceOf(IllegalStateException.class);
        assertThat(gate.snapshot()).containsKey("x");
    }
}
