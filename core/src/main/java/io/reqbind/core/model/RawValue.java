package io.reqbind.core.model;

/**
 * Result of a source lookup. {@code present=false} distinguishes an absent value from a present
 * empty string.
 *
 * @param text    the raw text, empty when absent
 * @param present whether the source carried the key at all
 */
public record RawValue(String text, boolean present) {

    private static final RawValue ABSENT = new RawValue("", false);

    public RawValue {
        if (text == null) {
            text = "";
        }
    }

    public static RawValue of(String text) {
        return new RawValue(text, true);
    }

    public static RawValue absent() {
        return ABSENT;
    }
}
