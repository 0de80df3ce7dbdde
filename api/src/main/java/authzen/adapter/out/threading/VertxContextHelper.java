package authzen.adapter.out.threading;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

/**
 * Utility for returning to the Vert.x context after AWS SDK calls.
 *
 * <p>The async AWS clients complete their futures on SDK-internal Netty threads.
 * Results are re-emitted on the Vert.x context of the calling request so that
 * entity mapping and decision mapping run where the request started.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * return VertxContextHelper.fromFuture(() -> client.batchGetItem(request))
 *     .map(this::toEntities);
 * }</pre>
 */
public final class VertxContextHelper {

    private static final Logger LOG = Logger.getLogger(VertxContextHelper.class);

    private VertxContextHelper() {
        // Utility class
    }

    /**
     * Returns an executor that runs tasks on the current Vert.x context.
     *
     * <p>Outside a Vert.x context (tests, startup) falls back to the default worker pool.
     *
     * @return an executor bound to the current Vert.x context, or the default worker pool
     */
    public static Executor eventLoopExecutor() {
        final var context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        LOG.debug("No Vert.x context available; emitting on the worker pool");
        return Infrastructure.getDefaultWorkerPool();
    }

    /**
     * Subscribe to an SDK future lazily and emit its result on the caller's context.
     *
     * @param future supplier invoked at subscription time
     * @param <T>    the result type
     * @return a Uni that emits on the Vert.x context
     */
    public static <T> Uni<T> fromFuture(Supplier<CompletableFuture<T>> future) {
        final var executor = eventLoopExecutor();
        return Uni.createFrom().completionStage(future).emitOn(executor);
    }
}
