package io.apipipeline.server.core.decorate;

import org.slf4j.event.Level;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Request log settings.
 *
 * <p>Header names and query keys in {@link #redacted()} are logged as {@code [REDACTED]}.
 */
public final class LoggingOptions {

    public static final String REDACTED = "[REDACTED]";

    static final Set<String> DEFAULT_REDACTED = Set.of(
            "authorization", "cookie", "set-cookie", "x-api-key", "x-auth-token", "x-refresh-token",
            "password", "secret", "token");

    private final Level level;
    private final boolean logHeaders;
    private final boolean logQuery;
    private final Set<String> redacted;

    private LoggingOptions(Builder b) {
        this.level = b.level;
        this.logHeaders = b.logHeaders;
        this.logQuery = b.logQuery;
        this.redacted = b.redacted;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LoggingOptions defaults() {
        return builder().build();
    }

    public Level level() {
        return level;
    }

    public boolean logHeaders() {
        return logHeaders;
    }

    public boolean logQuery() {
        return logQuery;
    }

    /** Lower-case names whose values are masked. */
    public Set<String> redacted() {
        return redacted;
    }

    public boolean isRedacted(String name) {
        return name != null && redacted.contains(name.toLowerCase(Locale.ROOT));
    }

    public static final class Builder {
        private Level level = Level.INFO;
        private boolean logHeaders;
        private boolean logQuery;
        private Set<String> redacted = DEFAULT_REDACTED;

        private Builder() {}

        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        public Builder logHeaders(boolean logHeaders) {
            this.logHeaders = logHeaders;
            return this;
        }

        public Builder logQuery(boolean logQuery) {
            this.logQuery = logQuery;
            return this;
        }

        /** Adds names to the default redaction set. */
        public Builder redact(String... names) {
            this.redacted = Stream.concat(redacted.stream(), Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT)))
                    .collect(Collectors.toUnmodifiableSet());
            return this;
        }

        public LoggingOptions build() {
            if (level == null) throw new IllegalArgumentException("level must not be null");
            return new LoggingOptions(this);
        }
    }
}
