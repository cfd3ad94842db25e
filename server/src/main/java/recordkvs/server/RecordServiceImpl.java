package recordkvs.server;

import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import recordkvs.RecordKvs;
import recordkvs.RecordServiceGrpc;
import recordkvs.util.StreamCancellation;

public class RecordServiceImpl extends RecordServiceGrpc.RecordServiceImplBase {

	private static final Logger logger = LoggerFactory.getLogger(RecordServiceImpl.class);

	RecordServerState server_state;

	public RecordServiceImpl(RecordServerState state) {
		this.server_state = state;
	}

	@Override
	public void getRecord(RecordKvs.GetRecordRequest request,
			StreamObserver<RecordKvs.Record> responseObserver) {
		logger.info("GetRecord called with id: {}", request.getId());
		try {
			StoredRecord record = this.server_state.getStore().get(request.getId());
			responseObserver.onNext(RecordConverter.toRecord(record));
			responseObserver.onCompleted();
		} catch (RecordNotFoundException e) {
			logger.debug("GetRecord miss for id {}", e.getId());
			responseObserver.onError(Status.NOT_FOUND.withDescription(e.getMessage()).asRuntimeException());
		} catch (RuntimeException e) {
			logger.error("GetRecord failed for id {}", request.getId(), e);
			responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
		}
	}

	@Override
	public void createRecord(RecordKvs.CreateRecordRequest request,
			StreamObserver<RecordKvs.Record> responseObserver) {
		logger.info("CreateRecord called with name: {}", request.getName());
		try {
			StoredRecord record = this.server_state.getStore().create(request.getName(), request.getContact(),
					request.getNumericAttribute());
			responseObserver.onNext(RecordConverter.toRecord(record));
			responseObserver.onCompleted();
		} catch (RuntimeException e) {
			logger.error("CreateRecord failed for name {}", request.getName(), e);
			responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
		}
	}

	@Override
	public void listRecordsStream(Empty request, StreamObserver<RecordKvs.Record> responseObserver) {
		logger.info("ListRecordsStream called - streaming all records");
		StreamCancellation cancellation = StreamCancellation.watch(responseObserver);
		new RecordStreamer(this.server_state.getStore(), this.server_state.getPacingMode(), cancellation,
				responseObserver).run();
	}

	@Override
	public StreamObserver<RecordKvs.CreateRecordRequest> batchCreateRecords(
			StreamObserver<RecordKvs.BatchCreateResponse> responseObserver) {
		logger.info("BatchCreateRecords called - receiving record stream");
		StreamCancellation cancellation = StreamCancellation.watch(responseObserver);
		return new BatchCreateObserver(this.server_state.getStore(), cancellation, responseObserver);
	}
}
