package authzen.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;

/**
 * Echoes the caller's {@code X-Request-ID} header on every response.
 *
 * <p>Runs at the Vert.x routing level so problem responses carry the header too.
 */
@ApplicationScoped
public class RequestIdFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @RouteFilter(100)
    void echoRequestId(RoutingContext rc) {
        final var requestId = rc.request().getHeader(REQUEST_ID_HEADER);
        if (requestId != null && !requestId.isEmpty()) {
            rc.response().putHeader(REQUEST_ID_HEADER, requestId);
        }
        rc.next();
    }
}
