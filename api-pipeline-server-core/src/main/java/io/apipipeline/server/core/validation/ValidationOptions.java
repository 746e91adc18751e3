package io.apipipeline.server.core.validation;

import io.apipipeline.server.spi.ValidationSchema;

import java.util.Optional;

/**
 * Schemas applied to the query string, the JSON body and the path parameters.
 */
public final class ValidationOptions {

    private final ValidationSchema<?> query;
    private final ValidationSchema<?> body;
    private final ValidationSchema<?> params;

    private ValidationOptions(Builder b) {
        this.query = b.query;
        this.body = b.body;
        this.params = b.params;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ValidationSchema<?>> query() {
        return Optional.ofNullable(query);
    }

    /** Applied to POST, PUT and PATCH requests only. */
    public Optional<ValidationSchema<?>> body() {
        return Optional.ofNullable(body);
    }

    public Optional<ValidationSchema<?>> params() {
        return Optional.ofNullable(params);
    }

    public static final class Builder {
        private ValidationSchema<?> query;
        private ValidationSchema<?> body;
        private ValidationSchema<?> params;

        private Builder() {}

        public Builder query(ValidationSchema<?> query) {
            this.query = query;
            return this;
        }

        public Builder body(ValidationSchema<?> body) {
            this.body = body;
            return this;
        }

        public Builder params(ValidationSchema<?> params) {
            this.params = params;
            return this;
        }

        public ValidationOptions build() {
            if (query == null && body == null && params == null) {
                throw new IllegalArgumentException("at least one schema is required");
            }
            return new ValidationOptions(this);
        }
    }
}
