package io.reqbind.core.error;

/**
 * Abstract parent for per-request errors. These are caught inside the request pipeline and turned
 * into field-level errors or a {@code 400} outcome; they never escape
 * {@code RequestProcessor.process()}.
 */
public abstract class ReqbindEvalException extends ReqbindException {

    private static final long serialVersionUID = 1L;

    protected ReqbindEvalException(String message, String endpointId) {
        super(message, endpointId, Phase.EVALUATION);
    }

    protected ReqbindEvalException(String message, Throwable cause, String endpointId) {
        super(message, cause, endpointId, Phase.EVALUATION);
    }
}
