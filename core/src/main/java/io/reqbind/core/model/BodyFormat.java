package io.reqbind.core.model;

/** How a request payload is decoded, chosen from its MIME type. */
public enum BodyFormat {
    /** {@code application/json}, any {@code +json} type, or no content type at all. */
    JSON,

    /** {@code application/x-www-form-urlencoded}. */
    FORM,

    /** Anything else; a non-empty payload of this format is rejected. */
    UNSUPPORTED;

    static final String JSON_MIME = "application/json";
    static final String FORM_MIME = "application/x-www-form-urlencoded";

    /**
     * Picks the format for a normalized MIME type (lower case, no parameters).
     *
     * @param mimeType the MIME type, or {@code null} when the request carried none
     */
    public static BodyFormat forMimeType(String mimeType) {
        if (mimeType == null || mimeType.equals(JSON_MIME) || mimeType.endsWith("+json")) {
            return JSON;
        }
        if (mimeType.equals(FORM_MIME)) {
            return FORM;
        }
        return UNSUPPORTED;
    }
}
