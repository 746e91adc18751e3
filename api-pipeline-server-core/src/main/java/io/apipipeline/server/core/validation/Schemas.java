package io.apipipeline.server.core.validation;

import io.apipipeline.server.spi.ValidationResult;
import io.apipipeline.server.spi.ValidationSchema;
import io.apipipeline.server.spi.Violation;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Schema builders for JSON-shaped values ({@code Map}, {@code List}, {@code String}, {@code Number},
 * {@code Boolean}).
 * <pre>{@code
 * ValidationSchema<Map<String, Object>> user = Schemas.object()
 *     .property("name", Schemas.string().required().minLength(2))
 *     .property("age", Schemas.number().min(0))
 *     .property("tags", Schemas.array(Schemas.string()).maxLength(5));
 * }</pre>
 *
 * <p>Schemas are configured fluently and should not be changed once in use.
 */
public final class Schemas {

    private Schemas() {}

    public static StringSchema string() {
        return new StringSchema();
    }

    public static NumberSchema number() {
        return new NumberSchema();
    }

    public static BooleanSchema bool() {
        return new BooleanSchema();
    }

    public static ObjectSchema object() {
        return new ObjectSchema();
    }

    public static ArraySchema array(ValidationSchema<?> items) {
        return new ArraySchema(items);
    }

    /**
     * Common handling of default, required, type and enum checks.
     */
    public abstract static class Base<T, S extends Base<T, S>> implements ValidationSchema<T> {
        private final String typeName;
        private final Class<?> javaType;
        private boolean required;
        private Object defaultValue;
        private List<Object> allowed;

        Base(String typeName, Class<?> javaType) {
            this.typeName = typeName;
            this.javaType = javaType;
        }

        @SuppressWarnings("unchecked")
        private S self() {
            return (S) this;
        }

        public S required() {
            this.required = true;
            return self();
        }

        /** Used when the input is absent. */
        public S defaultValue(Object value) {
            this.defaultValue = value;
            return self();
        }

        public S oneOf(Object... values) {
            this.allowed = List.of(values);
            return self();
        }

        @Override
        @SuppressWarnings("unchecked")
        public ValidationResult<T> validate(Object data) {
            Object value = data == null ? defaultValue : data;
            if (value == null) {
                if (required) return ValidationResult.invalid(null, List.of(new Violation("Value is required", "required")));
                return ValidationResult.valid(null);
            }
            if (!javaType.isInstance(value)) {
                String message = "Expected " + typeName + ", received " + typeOf(value);
                return ValidationResult.invalid((T) value, List.of(new Violation(message, "type")));
            }

            List<Violation> violations = new ArrayList<>();
            T result = check((T) value, violations);
            if (allowed != null && !contains(allowed, value)) {
                String names = allowed.stream().map(String::valueOf).collect(Collectors.joining(", "));
                violations.add(new Violation("Value must be one of: " + names, "enum"));
            }
            return violations.isEmpty() ? ValidationResult.valid(result) : ValidationResult.invalid((T) value, violations);
        }

        /**
         * Type-specific constraints.
         *
         * @return the validated (possibly rebuilt) value
         */
        abstract T check(T value, List<Violation> violations);
    }

    public static final class StringSchema extends Base<String, StringSchema> {
        private Integer minLength;
        private Integer maxLength;
        private Pattern pattern;

        StringSchema() {
            super("string", String.class);
        }

        public StringSchema minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public StringSchema maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /** Must be found somewhere in the value; anchor the expression to match it whole. */
        public StringSchema pattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        @Override
        String check(String value, List<Violation> violations) {
            if (minLength != null && value.length() < minLength) {
                violations.add(new Violation("String must be at least " + minLength + " characters", "minLength"));
            }
            if (maxLength != null && value.length() > maxLength) {
                violations.add(new Violation("String must be at most " + maxLength + " characters", "maxLength"));
            }
            if (pattern != null && !pattern.matcher(value).find()) {
                violations.add(new Violation("String does not match pattern", "pattern"));
            }
            return value;
        }
    }

    public static final class NumberSchema extends Base<Number, NumberSchema> {
        private Double min;
        private Double max;

        NumberSchema() {
            super("number", Number.class);
        }

        public NumberSchema min(double min) {
            this.min = min;
            return this;
        }

        public NumberSchema max(double max) {
            this.max = max;
            return this;
        }

        @Override
        Number check(Number value, List<Violation> violations) {
            double d = value.doubleValue();
            if (min != null && d < min) {
                violations.add(new Violation("Number must be greater than or equal to " + format(min), "min"));
            }
            if (max != null && d > max) {
                violations.add(new Violation("Number must be less than or equal to " + format(max), "max"));
            }
            return value;
        }
    }

    public static final class BooleanSchema extends Base<Boolean, BooleanSchema> {
        BooleanSchema() {
            super("boolean", Boolean.class);
        }

        @Override
        Boolean check(Boolean value, List<Violation> violations) {
            return value;
        }
    }

    /**
     * Object schema. With properties declared, the validated value holds exactly the declared
     * properties that have a value.
     */
    public static final class ObjectSchema extends Base<Map<String, Object>, ObjectSchema> {
        private final Map<String, ValidationSchema<?>> properties = new LinkedHashMap<>();

        ObjectSchema() {
            super("object", Map.class);
        }

        public ObjectSchema property(String name, ValidationSchema<?> schema) {
            properties.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(schema, "schema"));
            return this;
        }

        @Override
        Map<String, Object> check(Map<String, Object> value, List<Violation> violations) {
            if (properties.isEmpty()) return value;
            Map<String, Object> out = new LinkedHashMap<>();
            properties.forEach((name, schema) -> {
                ValidationResult<?> r = schema.validate(value.get(name));
                if (r.value() != null) out.put(name, r.value());
                r.violations().forEach(v -> violations.add(v.under(name)));
            });
            return out;
        }
    }

    public static final class ArraySchema extends Base<List<Object>, ArraySchema> {
        private final ValidationSchema<?> items;
        private Integer minLength;
        private Integer maxLength;

        ArraySchema(ValidationSchema<?> items) {
            super("array", List.class);
            this.items = Objects.requireNonNull(items, "items");
        }

        public ArraySchema minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public ArraySchema maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        @Override
        List<Object> check(List<Object> value, List<Violation> violations) {
            if (minLength != null && value.size() < minLength) {
                violations.add(new Violation("Array must contain at least " + minLength + " items", "minLength"));
            }
            if (maxLength != null && value.size() > maxLength) {
                violations.add(new Violation("Array must contain at most " + maxLength + " items", "maxLength"));
            }
            List<Object> out = new ArrayList<>(value.size());
            for (int i = 0; i < value.size(); i++) {
                ValidationResult<?> r = items.validate(value.get(i));
                out.add(r.value());
                int index = i;
                r.violations().forEach(v -> violations.add(v.under(index)));
            }
            return out;
        }
    }

    static String typeOf(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof List || value.getClass().isArray()) return "array";
        return "object";
    }

    private static boolean contains(List<Object> allowed, Object value) {
        for (Object a : allowed) {
            if (a instanceof Number an && value instanceof Number vn) {
                if (an.doubleValue() == vn.doubleValue()) return true;
            } else if (a.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static String format(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d) ? Long.toString((long) d) : Double.toString(d);
    }
}
