package io.reqbind.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.reqbind.core.engine.Endpoint;
import io.reqbind.core.engine.RequestProcessor;
import io.reqbind.core.engine.ResponseRenderer;
import io.reqbind.core.model.Outcome;
import io.reqbind.standalone.adapter.JavalinRequestAdapter;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Serves one endpoint: wraps the request, runs it through the {@link RequestProcessor} and writes
 * the rendered outcome.
 *
 * <p>The request id is taken from {@code X-Request-ID} (or generated), echoed on the response and
 * held in the MDC under {@code requestId} while the request is processed.
 */
public final class EndpointHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    private final Endpoint endpoint;
    private final RequestProcessor processor;
    private final JavalinRequestAdapter adapter;

    public EndpointHandler(Endpoint endpoint, RequestProcessor processor, JavalinRequestAdapter adapter) {
        this.endpoint = endpoint;
        this.processor = processor;
        this.adapter = adapter;
    }

    @Override
    public void handle(Context ctx) {
        String requestId = ctx.header(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(REQUEST_ID_HEADER, requestId);

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            Outcome outcome = processor.process(endpoint, adapter.wrap(ctx));
            if (!outcome.isValid()) {
                LOG.info("Request rejected: endpoint={}, status={}, errors={}",
                        endpoint.id(), outcome.httpStatus(), outcome.errorResponse().errors().size());
            }
            ctx.status(outcome.httpStatus());
            ctx.contentType("application/json");
            ctx.result(ResponseRenderer.renderString(outcome));
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    public Endpoint endpoint() {
        return endpoint;
    }
}
