package com.example.embeddingindex;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class SnapshotSchedulerTest {

    @Test
    public void keepsTickingAfterAFailedBackup() throws Exception {
        SnapshotManager snapshots = Mockito.mock(SnapshotManager.class);
        when(snapshots.backupToRemote())
                .thenThrow(new StorageIOException("bucket unreachable", null))
                .thenReturn(Instant.now());
        SnapshotScheduler scheduler = new SnapshotScheduler(snapshots, true, Duration.ofMillis(20), Duration.ofMillis(10));

        assertThat(scheduler.start()).isTrue();
        long deadline = System.currentTimeMillis() + 10_000;
        while (scheduler.getTicks() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        scheduler.stop();

        assertThat(scheduler.getTicks()).isGreaterThanOrEqualTo(4);
        assertThat(scheduler.getFailures()).isEqualTo(1);
        assertThat(scheduler.isRunning()).isFalse();
        verify(snapshots, atLeast(4)).backupToRemote();
    }

    @Test
    public void stopRunsOneFinalBackup() {
        SnapshotManager snapshots = Mockito.mock(SnapshotManager.class);
        SnapshotScheduler scheduler = new SnapshotScheduler(snapshots, true, Duration.ofHours(1), Duration.ofMillis(1));

        scheduler.start();
        scheduler.stop();

        verify(snapshots, times(1)).backupToRemote();
        assertThat(scheduler.getTicks()).isEqualTo(1);
    }

    @Test
    public void disabledSchedulerNeverBacksUp() {
        SnapshotManager snapshots = Mockito.mock(SnapshotManager.class);
        SnapshotScheduler scheduler = new SnapshotScheduler(snapshots, false, Duration.ofMinutes(5), SnapshotScheduler.MIN_INTERVAL);

        assertThat(scheduler.start()).isFalse();
        scheduler.stop();

        verifyNoInteractions(snapshots);
    }

    @Test
    public void intervalIsRaisedToTheFloor() {
        SnapshotManager snapshots = Mockito.mock(SnapshotManager.class);
        SnapshotScheduler scheduler = new SnapshotScheduler(snapshots, true, Duration.ofSeconds(5), SnapshotScheduler.MIN_INTERVAL);
        assertThat(scheduler.getInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(scheduler.start()).isTrue();
        assertThat(scheduler.start()).isFalse();
        scheduler.stop();
    }
}
