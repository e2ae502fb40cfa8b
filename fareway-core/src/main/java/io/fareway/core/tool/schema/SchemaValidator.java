package io.fareway.core.tool.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Validates raw caller arguments against an {@link InputSchema}. The returned map holds only
 * declared fields, with defaults applied and values coerced to their canonical Java type
 * ({@code String}, {@code Long}, {@code Double}, {@code Boolean}, {@code List<String>}), keyed
 * in sorted order so equal requests normalize to equal maps.
 */
public final class SchemaValidator {
    private static final Pattern UUID_PATTERN =
        Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private SchemaValidator() {
    }

    public static SortedMap<String, Object> validate(InputSchema schema, Map<String, Object> rawArgs) throws ToolArgumentException {
        Map<String, Object> raw = rawArgs == null ? Map.of() : rawArgs;
        SortedMap<String, Object> validated = new TreeMap<>();
        for (FieldSpec field : schema.fields()) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required()) {
                    throw new ToolArgumentException(field.name(), "required field is missing");
                }
                if (field.defaultValue() != null) {
                    validated.put(field.name(), field.defaultValue());
                }
                continue;
            }
            validated.put(field.name(), coerce(field, value));
        }
        return Collections.unmodifiableSortedMap(validated);
    }

    private static Object coerce(FieldSpec field, Object value) throws ToolArgumentException {
        return switch (field.type()) {
            case STRING -> checkString(field, value);
            case INTEGER -> toLong(field, value);
            case NUMBER -> toDouble(field, value);
            case BOOLEAN -> toBoolean(field, value);
            case STRING_ARRAY -> toStringList(field, value);
        };
    }

    private static String checkString(FieldSpec field, Object value) throws ToolArgumentException {
        if (!(value instanceof String text)) {
            throw new ToolArgumentException(field.name(), "expected string");
        }
        if (field.enumerated() && !field.allowedValues().contains(text)) {
            throw new ToolArgumentException(field.name(), "must be one of " + field.allowedValues());
        }
        if (FieldSpec.UUID_FORMAT.equals(field.format()) && !UUID_PATTERN.matcher(text).matches()) {
            throw new ToolArgumentException(field.name(), "must be a UUID");
        }
        return text;
    }

    private static Long toLong(FieldSpec field, Object value) throws ToolArgumentException {
        try {
            BigDecimal decimal;
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            } else if (value instanceof BigInteger bigInteger) {
                decimal = new BigDecimal(bigInteger);
            } else if (value instanceof Number number) {
                decimal = new BigDecimal(number.toString());
            } else if (value instanceof String text && !text.isBlank()) {
                decimal = new BigDecimal(text.trim());
            } else {
                throw new ToolArgumentException(field.name(), "expected integer");
            }
            return decimal.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ToolArgumentException(field.name(), "expected integer");
        }
    }

    private static Double toDouble(FieldSpec field, Object value) throws ToolArgumentException {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolArgumentException(field.name(), "expected number");
            }
        } else {
            throw new ToolArgumentException(field.name(), "expected number");
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new ToolArgumentException(field.name(), "expected number");
        }
        return parsed;
    }

    private static Boolean toBoolean(FieldSpec field, Object value) throws ToolArgumentException {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return true;
            }
            if ("false".equals(normalized)) {
                return false;
            }
        }
        throw new ToolArgumentException(field.name(), "expected boolean");
    }

    private static List<String> toStringList(FieldSpec field, Object value) throws ToolArgumentException {
        if (!(value instanceof List<?> items)) {
            throw new ToolArgumentException(field.name(), "expected array of strings");
        }
        List<String> out = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof String text)) {
                throw new ToolArgumentException(field.name(), "expected array of strings");
            }
            out.add(text);
        }
        return List.copyOf(out);
    }
}
