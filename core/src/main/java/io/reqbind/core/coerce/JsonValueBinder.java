package io.reqbind.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.reqbind.core.error.CoercionException;
import io.reqbind.core.model.ValueKind;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binds a value from an already decoded body into the representation of a {@link ValueKind}.
 *
 * <p>String nodes go through {@link ValueCoercer}, so {@code "42"} binds to an {@code int} field
 * and {@code "a, b"} to a {@code string-list} field exactly as the same text would from a query
 * string. Native JSON numbers, booleans and arrays bind directly when their shape matches; any
 * other shape fails with a {@link CoercionException} carrying the node's JSON text.
 *
 * <p>JSON {@code null} is never passed here; the pipeline treats it as an absent field.
 */
public final class JsonValueBinder {

    static final String NOT_SCALAR = "must be a scalar value";

    private static final BigInteger MAX_UNSIGNED = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private JsonValueBinder() {
        // utility class
    }

    /**
     * Binds {@code node} to {@code kind}.
     *
     * @throws CoercionException if the node's shape or value does not fit {@code kind}
     */
    public static Object bind(JsonNode node, ValueKind kind) {
        if (node.isTextual()) {
            return ValueCoercer.coerce(node.textValue(), kind);
        }
        if (node.isContainerNode() && !kind.isCollection()) {
            throw mismatch(NOT_SCALAR, node);
        }
        return switch (kind) {
            case STRING -> throw mismatch("must be a string", node);
            case INT -> bindInt(node);
            case UNSIGNED_INT -> bindUnsigned(node, ValueCoercer.INVALID_UINT);
            case BOOLEAN -> {
                if (!node.isBoolean()) {
                    throw mismatch(ValueCoercer.INVALID_BOOL, node);
                }
                yield node.booleanValue();
            }
            case STRING_LIST -> bindStringList(node);
            case UNSIGNED_INT_LIST -> bindUnsignedList(node);
        };
    }

    private static long bindInt(JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw mismatch(ValueCoercer.INVALID_INT, node);
        }
        return node.longValue();
    }

    private static long bindUnsigned(JsonNode node, String message) {
        if (!node.isIntegralNumber()) {
            throw mismatch(message, node);
        }
        BigInteger value = node.bigIntegerValue();
        if (value.signum() < 0 || value.compareTo(MAX_UNSIGNED) > 0) {
            throw mismatch(message, node);
        }
        return value.longValue();
    }

    private static List<String> bindStringList(JsonNode node) {
        if (!node.isArray()) {
            throw mismatch("must be a list", node);
        }
        List<String> result = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isTextual()) {
                throw mismatch("element " + (i + 1) + ": must be a string", node);
            }
            result.add(element.textValue());
        }
        return Collections.unmodifiableList(result);
    }

    private static List<Long> bindUnsignedList(JsonNode node) {
        if (!node.isArray()) {
            throw mismatch("must be a list", node);
        }
        List<Long> result = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            String message = ValueCoercer.elementError(i);
            if (element.isTextual()) {
                try {
                    result.add(ValueCoercer.parseUnsigned(element.textValue().trim()));
                } catch (CoercionException e) {
                    throw new CoercionException(message, node.toString(), e);
                }
            } else {
                try {
                    result.add(bindUnsigned(element, message));
                } catch (CoercionException e) {
                    throw new CoercionException(message, node.toString(), e);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static CoercionException mismatch(String message, JsonNode node) {
        return new CoercionException(message, node.toString());
    }
}
