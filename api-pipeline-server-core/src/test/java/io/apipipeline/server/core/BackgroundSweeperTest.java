package io.apipipeline.server.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackgroundSweeperTest {

    @Test
    void runsRepeatedlyUntilClosed() throws Exception {
        CountDownLatch ran = new CountDownLatch(3);
        BackgroundSweeper sweeper = new BackgroundSweeper("test-sweep", Duration.ofMillis(10), ran::countDown);
        try {
            assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(sweeper.isRunning()).isTrue();
        } finally {
            sweeper.close();
        }
        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void failingRunDoesNotStopLaterRuns() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        try (BackgroundSweeper ignored = new BackgroundSweeper("failing-sweep", Duration.ofMillis(10), () -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("boom");
            recovered.countDown();
        })) {
            assertThat(recovered.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new BackgroundSweeper("bad", Duration.ZERO, () -> {}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
