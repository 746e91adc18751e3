package io.apipipeline.server.spi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single schema violation.
 *
 * @param message human readable description
 * @param path location inside the validated value (property names and array indexes)
 * @param type violation kind, e.g. {@code required}, {@code minLength}, {@code enum}
 */
public record Violation(String message, List<Object> path, String type) {

    public Violation {
        Objects.requireNonNull(message, "message");
        path = path == null ? List.of() : List.copyOf(path);
    }

    public Violation(String message, String type) {
        this(message, List.of(), type);
    }

    /**
     * Returns a copy nested one level deeper, under {@code segment}.
     */
    public Violation under(Object segment) {
        List<Object> nested = new ArrayList<>(path.size() + 1);
        nested.add(segment);
        nested.addAll(path);
        return new Violation(message, nested, type);
    }
}
