package io.reqbind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Target type of a field after coercion.
 *
 * <p>Java representations: {@link #STRING} is {@link String}, {@link #INT} is {@link Long},
 * {@link #UNSIGNED_INT} is a {@link Long} holding the unsigned 64-bit value (compare and render it
 * through this enum, never with signed arithmetic), {@link #BOOLEAN} is {@link Boolean}, and the
 * list kinds are unmodifiable {@link List}s of the element representation.
 */
public enum ValueKind {
    STRING("string", Category.STRING, null),
    INT("int", Category.NUMBER, null),
    UNSIGNED_INT("uint", Category.NUMBER, null),
    BOOLEAN("bool", Category.BOOLEAN, null),
    STRING_LIST("string-list", Category.COLLECTION, STRING),
    UNSIGNED_INT_LIST("uint-list", Category.COLLECTION, UNSIGNED_INT);

    /** Shape of a kind, used to pick rule semantics and message variants. */
    public enum Category {
        STRING,
        NUMBER,
        BOOLEAN,
        COLLECTION
    }

    private final String typeName;
    private final Category category;
    private final ValueKind elementKind;

    ValueKind(String typeName, Category category, ValueKind elementKind) {
        this.typeName = typeName;
        this.category = category;
        this.elementKind = elementKind;
    }

    /** The name used in schema files ({@code string}, {@code uint-list}, ...). */
    public String typeName() {
        return typeName;
    }

    public Category category() {
        return category;
    }

    public boolean isCollection() {
        return category == Category.COLLECTION;
    }

    /** Element kind of a collection kind, {@code null} for scalars. */
    public ValueKind elementKind() {
        return elementKind;
    }

    /** The value an absent, optional field keeps. */
    public Object zeroValue() {
        return switch (this) {
            case STRING -> "";
            case INT, UNSIGNED_INT -> 0L;
            case BOOLEAN -> Boolean.FALSE;
            case STRING_LIST, UNSIGNED_INT_LIST -> List.of();
        };
    }

    /** True when {@code value} equals this kind's zero value (empty string, 0, false, empty list). */
    public boolean isZero(Object value) {
        if (value == null) {
            return true;
        }
        return switch (category) {
            case STRING -> ((String) value).isEmpty();
            case NUMBER -> ((Long) value) == 0L;
            case BOOLEAN -> !((Boolean) value);
            case COLLECTION -> ((List<?>) value).isEmpty();
        };
    }

    /**
     * Renders a value the way it is echoed back in errors and compared by membership rules.
     * Unsigned values are rendered unsigned; lists are comma-joined, so rendering a coerced list
     * and coercing it again yields the same list.
     */
    public String render(Object value) {
        if (value == null) {
            return "";
        }
        return switch (this) {
            case UNSIGNED_INT -> Long.toUnsignedString((Long) value);
            case STRING_LIST, UNSIGNED_INT_LIST -> ((List<?>) value)
                    .stream().map(elementKind::render).collect(Collectors.joining(","));
            default -> String.valueOf(value);
        };
    }

    /**
     * Numeric measure of a value for bound rules: code point count for strings, size for
     * collections, the value itself for numbers.
     *
     * @throws IllegalStateException for {@link #BOOLEAN}, which has no measure
     */
    public BigDecimal measure(Object value) {
        return switch (this) {
            case STRING -> BigDecimal.valueOf(((String) value).codePointCount(0, ((String) value).length()));
            case INT -> BigDecimal.valueOf((Long) value);
            case UNSIGNED_INT -> new BigDecimal(Long.toUnsignedString((Long) value));
            case STRING_LIST, UNSIGNED_INT_LIST -> BigDecimal.valueOf(((List<?>) value).size());
            case BOOLEAN -> throw new IllegalStateException("bool values have no numeric measure");
        };
    }

    /** Converts a value of this kind into a JSON node. */
    public JsonNode toJson(Object value) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (value == null) {
            return factory.nullNode();
        }
        return switch (this) {
            case STRING -> factory.textNode((String) value);
            case INT -> factory.numberNode((Long) value);
            case UNSIGNED_INT -> factory.numberNode(new BigInteger(Long.toUnsignedString((Long) value)));
            case BOOLEAN -> factory.booleanNode((Boolean) value);
            case STRING_LIST, UNSIGNED_INT_LIST -> {
                ArrayNode array = factory.arrayNode();
                ((List<?>) value).forEach(element -> array.add(elementKind.toJson(element)));
                yield array;
            }
        };
    }

    /**
     * Resolves a schema type name.
     *
     * @param typeName one of {@code string}, {@code int}, {@code uint}, {@code bool}, {@code
     *     string-list}, {@code uint-list}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ValueKind fromTypeName(String typeName) {
        if (typeName != null) {
            String normalized = typeName.trim().toLowerCase(Locale.ROOT);
            for (ValueKind kind : values()) {
                if (kind.typeName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported field type '" + typeName
                + "'; expected one of [string, int, uint, bool, string-list, uint-list]");
    }
}
