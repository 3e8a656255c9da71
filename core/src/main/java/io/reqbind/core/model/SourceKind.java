package io.reqbind.core.model;

import java.util.Locale;

/**
 * Origin of a field's raw value.
 *
 * <ul>
 *   <li>{@link #BODY}: the request payload, decoded once per request.
 *   <li>{@link #QUERY}: a single query parameter, looked up by exact name.
 *   <li>{@link #PATH}: a named segment of the matched route.
 * </ul>
 */
public enum SourceKind {
    BODY,
    QUERY,
    PATH;

    /**
     * Resolves the YAML spelling of a source ({@code body}, {@code query}, {@code path}). {@code
     * param} is accepted as an alias of {@code path}.
     *
     * @param name the configured name, case-insensitive
     * @return the matching source kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SourceKind fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "body" -> BODY;
            case "query" -> QUERY;
            case "path", "param" -> PATH;
            default -> throw new IllegalArgumentException(
                    "Unknown source '" + name + "'; expected one of [body, query, path]");
        };
    }
}
