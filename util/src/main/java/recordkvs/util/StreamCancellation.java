package recordkvs.util;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

import io.grpc.Context;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;

/**
 * Cooperative cancellation for server-side streams. Both directions go through it:
 * outbound streams iterate with {@link #forEach}, inbound streams admit each message
 * with {@link #accept}.
 * <p>
 * Must be created on the thread running the service method, before it returns: gRPC only
 * accepts an on-cancel handler then, and the call's {@link Context} is captured there. The
 * handler is delivered on the call's serialized executor, which a blocking handler occupies,
 * so the context is what reports a cancellation while the method is still looping.
 */
public class StreamCancellation {

    private final ServerCallStreamObserver<?> call;
    private final Context context;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public StreamCancellation(ServerCallStreamObserver<?> call) {
        this.call = call;
        this.context = Context.current();
        call.setOnCancelHandler(() -> cancelled.set(true));
    }

    public static StreamCancellation watch(StreamObserver<?> responseObserver) {
        return new StreamCancellation((ServerCallStreamObserver<?>) responseObserver);
    }

    public boolean isCancelled() {
        return cancelled.get() || context.isCancelled() || call.isCancelled();
    }

    /**
     * Waits for the transport to accept another message.
     *
     * @return {@code false} if the call was cancelled or the thread interrupted while waiting
     */
    public boolean awaitReady() {
        while (!call.isReady()) {
            if (isCancelled()) {
                return false;
            }
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !isCancelled();
    }

    /**
     * Runs {@code step} for each item in order, checking for cancellation before each one.
     * A step returning {@code false} also stops the iteration.
     *
     * @return {@code true} if every item was visited
     */
    public <T> boolean forEach(Iterable<T> items, Predicate<? super T> step) {
        for (T item : items) {
            if (isCancelled() || !step.test(item)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Hands one inbound message to {@code step} unless the call has been cancelled.
     *
     * @return {@code false} if the message was dropped
     */
    public <T> boolean accept(T item, Consumer<? super T> step) {
        if (isCancelled()) {
            return false;
        }
        step.accept(item);
        return true;
    }
}
