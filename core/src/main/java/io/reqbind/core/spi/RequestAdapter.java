package io.reqbind.core.spi;

import io.reqbind.core.source.RequestSources;

/**
 * Bridges a server's native request type to the engine's {@link RequestSources}.
 *
 * <p>Implementations copy what the pipeline reads (query parameters, matched path parameters, the
 * raw body and its content type) and nothing else. They must not decode the body; that happens
 * once inside the pipeline and only when an endpoint reads body fields.
 *
 * @param <R> the server's native request type
 */
public interface RequestAdapter<R> {

    /**
     * Builds the sources for one request.
     *
     * @param nativeRequest the server request, never null
     * @return the request's sources
     */
    RequestSources wrap(R nativeRequest);
}
