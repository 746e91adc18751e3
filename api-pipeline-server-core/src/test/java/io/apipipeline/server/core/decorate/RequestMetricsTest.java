package io.apipipeline.server.core.decorate;

import io.apipipeline.core.HttpMethod;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RequestMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final RequestMetrics metrics = new RequestMetrics(registry);

    @Test
    void countsByStatusAndMethod() {
        record(HttpMethod.GET, 200, 10);
        record(HttpMethod.GET, 200, 30);
        record(HttpMethod.POST, 429, 5);

        assertThat(registry.get(RequestMetrics.REQUESTS).tag("status", "200").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(RequestMetrics.REQUESTS).tag("method", "POST").tag("outcome", "CLIENT_ERROR")
                .counter().count()).isEqualTo(1.0);
        double total = registry.find(RequestMetrics.REQUESTS).counters().stream().mapToDouble(c -> c.count()).sum();
        assertThat(total).isEqualTo(3.0);
    }

    @Test
    void timesResponsesPerOutcome() {
        record(HttpMethod.GET, 200, 10);
        record(HttpMethod.GET, 200, 30);

        Timer timer = registry.get(RequestMetrics.RESPONSE_TIME).tag("outcome", "SUCCESS").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
        assertThat(timer.max(TimeUnit.MILLISECONDS)).isEqualTo(30.0);
    }

    @Test
    void activeGaugeFollowsStartAndCompletion() {
        metrics.started();
        metrics.started();
        assertThat(registry.get(RequestMetrics.ACTIVE).gauge().value()).isEqualTo(2.0);

        metrics.completed("orders", HttpMethod.GET, 500, Duration.ofMillis(1));
        assertThat(metrics.active()).isEqualTo(1);
        assertThat(registry.get(RequestMetrics.REQUESTS).tag("outcome", "SERVER_ERROR").counter().count()).isEqualTo(1.0);
    }

    @Test
    void outcomeFollowsStatusClass() {
        assertThat(RequestMetrics.outcome(101)).isEqualTo("INFORMATIONAL");
        assertThat(RequestMetrics.outcome(204)).isEqualTo("SUCCESS");
        assertThat(RequestMetrics.outcome(304)).isEqualTo("REDIRECTION");
        assertThat(RequestMetrics.outcome(408)).isEqualTo("CLIENT_ERROR");
        assertThat(RequestMetrics.outcome(503)).isEqualTo("SERVER_ERROR");
    }

    private void record(HttpMethod method, int status, long millis) {
        metrics.started();
        metrics.completed("orders", method, status, Duration.ofMillis(millis));
    }
}
