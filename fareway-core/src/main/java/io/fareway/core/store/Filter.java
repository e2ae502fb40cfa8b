package io.fareway.core.store;

import java.util.Objects;

/**
 * One predicate of a {@link Query}. For {@link FilterOp#ILIKE} the value is a pattern where
 * {@code %} matches any run of characters, {@code _} any single character, and a backslash
 * makes the next character literal.
 */
public record Filter(String field, FilterOp op, Object value) {
    public static final char LIKE_ESCAPE = '\\';

    public Filter {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
