package io.reqbind.core.coerce;

import io.reqbind.core.error.CoercionException;
import io.reqbind.core.model.ValueKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw text into a typed field value.
 *
 * <ul>
 *   <li>{@code string}: passed through unchanged, no trimming.
 *   <li>{@code int}: base 10, optional sign, whole string, 64-bit.
 *   <li>{@code uint}: base 10 digits only, whole string, up to 2^64-1.
 *   <li>{@code bool}: {@code true/1/on/yes} or {@code false/0/off/no/""}, case-insensitive.
 *   <li>{@code string-list}: split on {@code ,}, each element trimmed; all-blank input is the
 *       empty list.
 *   <li>{@code uint-list}: split on {@code ,}, each element trimmed and parsed as {@code uint};
 *       the first bad element fails the whole value with its 1-based index.
 * </ul>
 *
 * <p>Pure and thread-safe. Failure is always a {@link CoercionException}.
 */
public final class ValueCoercer {

    static final String INVALID_INT = "must be a valid integer";
    static final String INVALID_UINT = "must be a positive integer";
    static final String INVALID_BOOL = "must be a boolean";

    private static final Pattern SIGNED_DIGITS = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private ValueCoercer() {
        // utility class
    }

    /**
     * Coerces {@code raw} into the representation of {@code kind}.
     *
     * @param raw  the raw text, never null
     * @param kind the target kind
     * @return the typed value
     * @throws CoercionException if the text does not represent a value of {@code kind}
     */
    public static Object coerce(String raw, ValueKind kind) {
        if (raw == null) {
            throw new CoercionException("value must not be null", "");
        }
        return switch (kind) {
            case STRING -> raw;
            case INT -> parseInt(raw);
            case UNSIGNED_INT -> parseUnsigned(raw);
            case BOOLEAN -> parseBoolean(raw);
            case STRING_LIST -> splitStrings(raw);
            case UNSIGNED_INT_LIST -> splitUnsigned(raw);
        };
    }

    static long parseInt(String raw) {
        if (!SIGNED_DIGITS.matcher(raw).matches()) {
            throw new CoercionException(INVALID_INT, raw);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CoercionException(INVALID_INT, raw, e);
        }
    }

    /** Parses an unsigned 64-bit value; the result carries the unsigned bit pattern. */
    static long parseUnsigned(String raw) {
        if (!DIGITS.matcher(raw).matches()) {
            throw new CoercionException(INVALID_UINT, raw);
        }
        try {
            return Long.parseUnsignedLong(raw);
        } catch (NumberFormatException e) {
            throw new CoercionException(INVALID_UINT, raw, e);
        }
    }

    static boolean parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "on", "yes" -> true;
            case "false", "0", "off", "no", "" -> false;
            default -> throw new CoercionException(INVALID_BOOL, raw);
        };
    }

    static List<String> splitStrings(String raw) {
        String[] parts = raw.split(",", -1);
        List<String> result = new ArrayList<>(parts.length);
        boolean allBlank = true;
        for (String part : parts) {
            String trimmed = part.trim();
            allBlank &= trimmed.isEmpty();
            result.add(trimmed);
        }
        return allBlank ? List.of() : Collections.unmodifiableList(result);
    }

    static List<Long> splitUnsigned(String raw) {
        if (raw.isBlank()) {
            return List.of();
        }
        String[] parts = raw.split(",", -1);
        List<Long> result = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String element = parts[i].trim();
            if (!DIGITS.matcher(element).matches()) {
                throw new CoercionException(elementError(i), raw);
            }
            try {
                result.add(Long.parseUnsignedLong(element));
            } catch (NumberFormatException e) {
                throw new CoercionException(elementError(i), raw, e);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** Message for a bad list element; {@code index} is 0-based, the message is 1-based. */
    static String elementError(int index) {
        return "element " + (index + 1) + ": must be positive integer";
    }
}
