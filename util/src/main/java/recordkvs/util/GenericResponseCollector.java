package recordkvs.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Gathers the messages of one call as they arrive on a gRPC callback thread,
 * and lets the calling thread block until the call ends.
 */
public class GenericResponseCollector<T> {

    private final List<T> collectedResponses = new ArrayList<>();
    private Throwable error;
    private boolean completed;

    public GenericResponseCollector() {
        this.error = null;
        this.completed = false;
    }

    public synchronized void addResponse(T response) {
        if (!completed) {
            collectedResponses.add(response);
            notifyAll();
        }
    }

    public synchronized void complete() {
        completed = true;
        notifyAll();
    }

    public synchronized void fail(Throwable t) {
        if (!completed) {
            error = t;
            completed = true;
            notifyAll();
        }
    }

    /**
     * @return {@code false} if the timeout elapsed before the call ended
     */
    public synchronized boolean waitForCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!completed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized Throwable getError() {
        return error;
    }

    public synchronized List<T> getResponses() {
        return new ArrayList<>(collectedResponses);
    }
}
