package recordkvs.util;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CollectorStreamObserver<T> implements StreamObserver<T> {

    private static final Logger logger = LoggerFactory.getLogger(CollectorStreamObserver.class);

    private final GenericResponseCollector<T> collector;

    public CollectorStreamObserver(GenericResponseCollector<T> c) {
        collector = c;
    }

    @Override
    public void onNext(T value) {
        logger.debug("Received response: {}", value);
        collector.addResponse(value);
    }

    @Override
    public void onError(Throwable t) {
        logger.debug("Call ended with error: {}", Status.fromThrowable(t));
        collector.fail(t);
    }

    @Override
    public void onCompleted() {
        logger.debug("Stream completed");
        collector.complete();
    }
}
