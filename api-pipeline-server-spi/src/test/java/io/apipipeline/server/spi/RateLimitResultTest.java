package io.apipipeline.server.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitResultTest {

    @Test
    void nthRequestWithinLimitIsAllowed() {
        RateLimitResult result = RateLimitResult.of(new RateWindow(3, 60_000), 3, 0);

        assertThat(result.limited()).isFalse();
        assertThat(result.remaining()).isZero();
        assertThat(result.reset()).isEqualTo(60);
        assertThat(result.retryAfter()).isZero();
    }

    @Test
    void exceedingLimitReportsRetryAfter() {
        RateLimitResult result = RateLimitResult.of(new RateWindow(4, 60_000), 3, 500);

        assertThat(result.limited()).isTrue();
        assertThat(result.remaining()).isZero();
        assertThat(result.reset()).isEqualTo(60);
        assertThat(result.retryAfter()).isEqualTo(60);
    }

    @Test
    void windowEndsStrictlyAfterResetAt() {
        RateWindow window = RateWindow.open(1_000, 10);

        assertThat(window.resetAt()).isEqualTo(11_000);
        assertThat(window.hasEnded(11_000)).isFalse();
        assertThat(window.hasEnded(11_001)).isTrue();
    }
}
