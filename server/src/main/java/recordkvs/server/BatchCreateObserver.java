package recordkvs.server;

import java.util.ArrayList;
import java.util.List;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import recordkvs.RecordKvs;
import recordkvs.util.StreamCancellation;

/**
 * Inbound side of BatchCreateRecords.
 * <p>
 * Requests are staged in arrival order and committed to the store in one step when the client
 * half-closes. An aborted or cancelled stream commits nothing and gets no response.
 */
class BatchCreateObserver implements StreamObserver<RecordKvs.CreateRecordRequest> {

	private static final Logger logger = LoggerFactory.getLogger(BatchCreateObserver.class);

	private final RecordStore store;
	private final StreamCancellation cancellation;
	private final StreamObserver<RecordKvs.BatchCreateResponse> responseObserver;
	private final List<RecordDraft> drafts = new ArrayList<>();

	BatchCreateObserver(RecordStore store, StreamCancellation cancellation,
			StreamObserver<RecordKvs.BatchCreateResponse> responseObserver) {
		this.store = store;
		this.cancellation = cancellation;
		this.responseObserver = responseObserver;
	}

	@Override
	public void onNext(RecordKvs.CreateRecordRequest request) {
		boolean staged = cancellation.accept(request, r -> {
			logger.info("Batch received record: {}", r.getName());
			drafts.add(RecordConverter.toDraft(r));
		});
		if (!staged) {
			logger.debug("Dropping batch request for {}, call was cancelled", request.getName());
		}
	}

	@Override
	public void onError(Throwable t) {
		logger.warn("BatchCreateRecords aborted with {} staged records discarded: {}", drafts.size(),
				Status.fromThrowable(t));
		drafts.clear();
	}

	@Override
	public void onCompleted() {
		if (cancellation.isCancelled()) {
			logger.warn("BatchCreateRecords cancelled before commit, {} staged records discarded", drafts.size());
			drafts.clear();
			return;
		}
		List<StoredRecord> created = store.createAll(drafts);
		drafts.clear();

		RecordKvs.BatchCreateResponse.Builder response = RecordKvs.BatchCreateResponse.newBuilder()
				.setCreatedCount(created.size());
		for (StoredRecord record : created) {
			response.addRecords(RecordConverter.toRecord(record));
		}
		responseObserver.onNext(response.build());
		responseObserver.onCompleted();
		logger.info("Batch created {} records", created.size());
	}
}
