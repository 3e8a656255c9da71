package io.reqbind.core.source;

import io.reqbind.core.model.RawValue;
import java.util.List;
import java.util.Map;

/**
 * Single-value lookup over one textual source (query string or path parameters). Implementations
 * report absence with {@link RawValue#absent()} instead of throwing.
 */
@FunctionalInterface
public interface SourceReader {

    /**
     * Looks up a key by exact name.
     *
     * @param key the wire name
     * @return the value and whether it was present
     */
    RawValue lookup(String key);

    /** A reader over a single-value map. */
    static SourceReader of(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return empty();
        }
        Map<String, String> copy = Map.copyOf(values);
        return key -> copy.containsKey(key) ? RawValue.of(copy.get(key)) : RawValue.absent();
    }

    /**
     * A reader over a multi-value map where the first value wins. A key mapped to an empty list
     * counts as present with empty text.
     */
    static SourceReader ofMulti(Map<String, List<String>> values) {
        if (values == null || values.isEmpty()) {
            return empty();
        }
        Map<String, List<String>> copy = Map.copyOf(values);
        return key -> {
            List<String> all = copy.get(key);
            if (all == null) {
                return RawValue.absent();
            }
            return RawValue.of(all.isEmpty() ? "" : all.get(0));
        };
    }

    /** A reader that reports every key as absent. */
    static SourceReader empty() {
        return key -> RawValue.absent();
    }
}
