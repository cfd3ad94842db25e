package recordkvs.util;

import io.grpc.Status;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectorStreamObserverTest {

    @Test
    void forwardsMessagesAndCompletion() {
        GenericResponseCollector<String> collector = new GenericResponseCollector<>();
        CollectorStreamObserver<String> observer = new CollectorStreamObserver<>(collector);

        observer.onNext("first");
        observer.onNext("second");
        observer.onCompleted();

        assertEquals(List.of("first", "second"), collector.getResponses());
        assertTrue(collector.isCompleted());
    }

    @Test
    void forwardsErrors() {
        GenericResponseCollector<String> collector = new GenericResponseCollector<>();
        CollectorStreamObserver<String> observer = new CollectorStreamObserver<>(collector);

        observer.onError(Status.NOT_FOUND.withDescription("missing").asRuntimeException());

        assertTrue(collector.isCompleted());
        assertEquals(Status.Code.NOT_FOUND, Status.fromThrowable(collector.getError()).getCode());
    }
}
