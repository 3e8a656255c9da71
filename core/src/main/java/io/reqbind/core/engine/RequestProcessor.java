package io.reqbind.core.engine;

import io.reqbind.core.error.BodyDecodeException;
import io.reqbind.core.model.ErrorResponse;
import io.reqbind.core.model.FieldDescriptor;
import io.reqbind.core.model.Outcome;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.model.ValidationError;
import io.reqbind.core.rule.Validator;
import io.reqbind.core.source.RequestSources;
import io.reqbind.core.spi.ValidationListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one request through extraction and validation.
 *
 * <p>Any presence or coercion error, or a payload that cannot be decoded, yields {@link
 * Outcome.Type#BAD_REQUEST} and validation does not run. Otherwise the validator runs under the
 * endpoint's group and the result is {@link Outcome.Type#UNPROCESSABLE} or {@link
 * Outcome.Type#VALID}. Per-request errors never escape as exceptions.
 *
 * <p>Thread-safe. The optional {@link ValidationListener} is notified after each request; its
 * failures are logged and ignored.
 */
public final class RequestProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(RequestProcessor.class);

    private final Validator validator;
    private final ValidationListener listener;

    public RequestProcessor(Validator validator) {
        this(validator, null);
    }

    /**
     * @param validator the validator shared by all endpoints
     * @param listener  optional lifecycle listener, may be null
     */
    public RequestProcessor(Validator validator, ValidationListener listener) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.listener = listener;
    }

    /**
     * Processes a request for a compiled endpoint. Valid outcomes carry the endpoint's success
     * status.
     */
    public Outcome process(Endpoint endpoint, RequestSources sources) {
        long start = System.nanoTime();
        Outcome outcome = evaluate(endpoint.schema(), endpoint.descriptors(), endpoint.group(), sources);
        if (outcome.isValid() && endpoint.successStatus() != outcome.httpStatus()) {
            outcome = Outcome.valid(outcome.record(), endpoint.successStatus());
        }
        long durationMicros = (System.nanoTime() - start) / 1_000;

        if (outcome.isValid()) {
            LOG.debug("request.valid: endpoint={}, status={}, durationMicros={}",
                    endpoint.id(), outcome.httpStatus(), durationMicros);
            notifyValid(endpoint.id(), outcome.httpStatus(), durationMicros);
        } else {
            int errorCount = outcome.errorResponse().errors().size();
            LOG.debug("request.rejected: endpoint={}, status={}, errors={}, durationMicros={}",
                    endpoint.id(), outcome.httpStatus(), errorCount, durationMicros);
            notifyRejected(endpoint.id(), outcome.httpStatus(), errorCount, durationMicros);
        }
        return outcome;
    }

    /**
     * Processes a request against loose descriptors. Valid outcomes answer {@code 200}.
     *
     * @param schema      the record schema the descriptors refer to
     * @param descriptors field descriptors in declaration order
     * @param group       validation group, or {@code null}
     * @param sources     the request's sources
     */
    public Outcome process(
            RecordSchema schema, List<FieldDescriptor> descriptors, String group, RequestSources sources) {
        return evaluate(schema, descriptors, group, sources);
    }

    // --- Private helpers ---

    private Outcome evaluate(
            RecordSchema schema, List<FieldDescriptor> descriptors, String group, RequestSources sources) {
        Extraction extraction;
        try {
            extraction = new ExtractionPipeline(schema).extract(descriptors, sources);
        } catch (BodyDecodeException e) {
            LOG.debug("Request body rejected: {}", e.getMessage());
            return Outcome.badRequest(new ErrorResponse(400, e.getMessage(), List.of()));
        }
        if (extraction.failed()) {
            return Outcome.badRequest(ErrorResponse.badRequest(extraction.errors()));
        }

        List<ValidationError> violations = validator.validate(extraction.record(), descriptors, group);
        if (!violations.isEmpty()) {
            return Outcome.unprocessable(ErrorResponse.unprocessable(violations));
        }
        return Outcome.valid(extraction.record());
    }

    private void notifyValid(String endpointId, int status, long durationMicros) {
        if (listener == null) return;
        try {
            listener.onRequestValid(new ValidationListener.RequestValidEvent(endpointId, status, durationMicros));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onRequestValid failed", e);
        }
    }

    private void notifyRejected(String endpointId, int status, int errorCount, long durationMicros) {
        if (listener == null) return;
        try {
            listener.onRequestRejected(
                    new ValidationListener.RequestRejectedEvent(endpointId, status, errorCount, durationMicros));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onRequestRejected failed", e);
        }
    }
}
