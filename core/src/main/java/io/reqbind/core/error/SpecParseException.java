package io.reqbind.core.error;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * A schema or endpoint file could not be read or does not have the expected shape. When the
 * failure comes from the YAML parser, {@link #line()} is the 1-based line it stopped at.
 */
public final class SpecParseException extends ReqbindLoadException {

    private static final long serialVersionUID = 1L;

    public static final int UNKNOWN_LINE = -1;

    private final int line;

    public SpecParseException(String message, String endpointId, String source) {
        super(message, endpointId, source);
        this.line = UNKNOWN_LINE;
    }

    public SpecParseException(String message, Throwable cause, String endpointId, String source) {
        super(message, cause, endpointId, source);
        this.line = lineOf(cause);
    }

    /** Wraps a YAML syntax error from {@code source}. */
    public static SpecParseException malformedYaml(JsonProcessingException cause, String source) {
        return new SpecParseException("Failed to parse YAML: " + cause.getOriginalMessage(), cause, null, source);
    }

    /** Line of the YAML error, or {@link #UNKNOWN_LINE}. */
    public int line() {
        return line;
    }

    private static int lineOf(Throwable cause) {
        if (cause instanceof JsonProcessingException jpe) {
            JsonLocation location = jpe.getLocation();
            if (location != null && location.getLineNr() > 0) {
                return location.getLineNr();
            }
        }
        return UNKNOWN_LINE;
    }
}
