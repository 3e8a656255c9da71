package io.reqbind.core.error;

/**
 * Thrown when an endpoint definition is inconsistent: a field that the record schema does not
 * know, an unregistered rule, a non-numeric bound, a default literal that does not coerce, or a
 * collection rule on a scalar field.
 */
public final class EndpointConfigException extends ReqbindLoadException {

    private static final long serialVersionUID = 1L;

    public EndpointConfigException(String message, String endpointId, String source) {
        super(message, endpointId, source);
    }

    public EndpointConfigException(String message, Throwable cause, String endpointId, String source) {
        super(message, cause, endpointId, source);
    }
}
