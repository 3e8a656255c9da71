package io.reqbind.core.spi;

/**
 * SPI for observability hooks.
 *
 * <p>Adapters bridge these events to whatever metrics or audit system they run under; the core has
 * no telemetry dependencies. Events are immutable. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by a listener are caught and logged by the caller and never
 * change the outcome of a request or a load.
 */
public interface ValidationListener {

    /**
     * Called when an endpoint definition was parsed and compiled.
     *
     * @param event contains endpointId, method, path, sourcePath, fieldCount
     */
    void onEndpointLoaded(EndpointLoadedEvent event);

    /**
     * Called when an endpoint definition was rejected at load time.
     *
     * @param event contains sourcePath, errorDetail
     */
    void onEndpointRejected(EndpointRejectedEvent event);

    /**
     * Called when a request decoded and passed every rule.
     *
     * @param event contains endpointId, status, durationMicros
     */
    void onRequestValid(RequestValidEvent event);

    /**
     * Called when a request was answered with 400 or 422.
     *
     * @param event contains endpointId, status, errorCount, durationMicros
     */
    void onRequestRejected(RequestRejectedEvent event);

    // --- Event records ---

    /** Event emitted when an endpoint is loaded. */
    record EndpointLoadedEvent(String endpointId, String method, String path, String sourcePath, int fieldCount) {}

    /** Event emitted when an endpoint definition is rejected. */
    record EndpointRejectedEvent(String sourcePath, String errorDetail) {}

    /** Event emitted for a valid request. */
    record RequestValidEvent(String endpointId, int status, long durationMicros) {}

    /** Event emitted for a rejected request. */
    record RequestRejectedEvent(String endpointId, int status, int errorCount, long durationMicros) {}
}
