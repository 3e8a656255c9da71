package io.reqbind.standalone.adapter;

import io.javalin.http.Context;
import io.reqbind.core.model.RequestBody;
import io.reqbind.core.source.RequestSources;
import io.reqbind.core.source.SourceReader;
import io.reqbind.core.spi.RequestAdapter;

/**
 * {@link RequestAdapter} for Javalin: query parameters (first value wins), matched path
 * parameters, and the raw body with its Content-Type. Stateless and thread-safe.
 */
public final class JavalinRequestAdapter implements RequestAdapter<Context> {

    @Override
    public RequestSources wrap(Context ctx) {
        return new RequestSources(
                SourceReader.ofMulti(ctx.queryParamMap()),
                SourceReader.of(ctx.pathParamMap()),
                RequestBody.of(ctx.bodyAsBytes(), ctx.contentType()));
    }
}
