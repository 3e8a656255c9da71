package io.reqbind.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.reqbind.core.engine.Endpoint;
import io.reqbind.core.engine.EndpointRegistry;

/**
 * Liveness probe listing the served routes:
 *
 * <pre>{@code
 * {"status":"UP","endpoints":[{"id":"create-user","route":"POST /users"}]}
 * }</pre>
 *
 * The registry never changes after startup, so the body is rendered once.
 */
public final class HealthHandler implements Handler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String body;

    public HealthHandler(EndpointRegistry registry) {
        this.body = render(registry);
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }

    static String render(EndpointRegistry registry) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("status", "UP");
        ArrayNode endpoints = root.putArray("endpoints");
        for (Endpoint endpoint : registry.endpoints()) {
            endpoints.addObject()
                    .put("id", endpoint.id())
                    .put("route", endpoint.method() + " " + endpoint.path());
        }
        return root.toString();
    }
}
