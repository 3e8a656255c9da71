package io.reqbind.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Undecoded request payload and the MIME type it was sent with.
 *
 * <p>The MIME type is normalized on construction: parameters such as {@code charset} are dropped
 * and the rest is lower-cased, so {@code Application/JSON; charset=UTF-8} is stored as {@code
 * application/json}. A missing or blank Content-Type is stored as {@code null}.
 *
 * @param content  payload bytes, never null
 * @param mimeType normalized MIME type, or {@code null}
 */
public record RequestBody(byte[] content, String mimeType) {

    private static final RequestBody EMPTY = new RequestBody(new byte[0], null);

    public RequestBody {
        content = content != null ? content : new byte[0];
        mimeType = normalize(mimeType);
    }

    /** A JSON payload, UTF-8 encoded. */
    public static RequestBody json(String content) {
        return new RequestBody(utf8(content), BodyFormat.JSON_MIME);
    }

    /** A form-urlencoded payload, UTF-8 encoded. */
    public static RequestBody form(String content) {
        return new RequestBody(utf8(content), BodyFormat.FORM_MIME);
    }

    /**
     * A payload as received from a server.
     *
     * @param content     raw bytes, may be null
     * @param contentType the Content-Type header value, may be null
     */
    public static RequestBody of(byte[] content, String contentType) {
        return new RequestBody(content, contentType);
    }

    public static RequestBody empty() {
        return EMPTY;
    }

    public BodyFormat format() {
        return BodyFormat.forMimeType(mimeType);
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    // Arrays compare by reference in a record's generated equals

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestBody that)) return false;
        return Objects.equals(mimeType, that.mimeType) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + Objects.hashCode(mimeType);
    }

    @Override
    public String toString() {
        return "RequestBody[" + (mimeType != null ? mimeType : "no content type") + ", " + content.length
                + " bytes]";
    }

    private static String normalize(String contentType) {
        if (contentType == null) {
            return null;
        }
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return mime.isEmpty() ? null : mime;
    }

    private static byte[] utf8(String content) {
        return content != null ? content.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }
}
