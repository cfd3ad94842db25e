package recordkvs.server;

import java.util.List;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import recordkvs.RecordKvs;
import recordkvs.util.PacingMode;
import recordkvs.util.StreamCancellation;

/**
 * Outbound side of ListRecordsStream: emits a snapshot of the store, one record per message,
 * pausing between messages and stopping quietly once the client cancels.
 */
class RecordStreamer {

	private static final Logger logger = LoggerFactory.getLogger(RecordStreamer.class);

	private final RecordStore store;
	private final PacingMode pacing_mode;
	private final StreamCancellation cancellation;
	private final StreamObserver<RecordKvs.Record> responseObserver;
	private int sent;

	RecordStreamer(RecordStore store, PacingMode pacingMode, StreamCancellation cancellation,
			StreamObserver<RecordKvs.Record> responseObserver) {
		this.store = store;
		this.pacing_mode = pacingMode;
		this.cancellation = cancellation;
		this.responseObserver = responseObserver;
	}

	void run() {
		List<StoredRecord> snapshot = store.list();
		logger.debug("Streaming snapshot of {} records", snapshot.size());

		boolean finished = cancellation.forEach(snapshot, this::emit);
		if (finished) {
			responseObserver.onCompleted();
			logger.debug("Record stream completed after {} records", sent);
		} else if (cancellation.isCancelled()) {
			logger.debug("Record stream cancelled by client after {} of {} records", sent, snapshot.size());
		} else {
			// interrupted, the call is still open
			responseObserver.onError(Status.CANCELLED
					.withDescription("Record stream interrupted after " + sent + " records")
					.asRuntimeException());
		}
	}

	private boolean emit(StoredRecord record) {
		if (!cancellation.awaitReady()) {
			return false;
		}
		responseObserver.onNext(RecordConverter.toRecord(record));
		sent++;
		return pacing_mode.pause();
	}
}
