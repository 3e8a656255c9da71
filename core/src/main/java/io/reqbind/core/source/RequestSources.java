package io.reqbind.core.source;

import io.reqbind.core.model.RequestBody;
import io.reqbind.core.model.SourceKind;

/**
 * Everything the pipeline reads from one request: the query and path readers and the undecoded
 * body. Built by a {@link io.reqbind.core.spi.RequestAdapter} per request.
 *
 * @param query query parameter reader
 * @param path  path parameter reader
 * @param body  raw payload, decoded at most once per request by {@link BodyDecoder}
 */
public record RequestSources(SourceReader query, SourceReader path, RequestBody body) {

    private static final RequestSources EMPTY =
            new RequestSources(SourceReader.empty(), SourceReader.empty(), RequestBody.empty());

    public RequestSources {
        query = query != null ? query : SourceReader.empty();
        path = path != null ? path : SourceReader.empty();
        body = body != null ? body : RequestBody.empty();
    }

    public static RequestSources empty() {
        return EMPTY;
    }

    /**
     * Returns the per-key reader for a textual source.
     *
     * @throws IllegalArgumentException for {@link SourceKind#BODY}; body fields are bound from the
     *     decoded payload, not looked up one by one
     */
    public SourceReader reader(SourceKind kind) {
        return switch (kind) {
            case QUERY -> query;
            case PATH -> path;
            case BODY -> throw new IllegalArgumentException("body fields are bound from the decoded payload");
        };
    }

    public RequestSources withQuery(SourceReader query) {
        return new RequestSources(query, path, body);
    }

    public RequestSources withPath(SourceReader path) {
        return new RequestSources(query, path, body);
    }

    public RequestSources withBody(RequestBody body) {
        return new RequestSources(query, path, body);
    }
}
