package recordkvs.client;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.google.protobuf.Empty;
import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import recordkvs.RecordKvs;
import recordkvs.RecordServiceGrpc;
import recordkvs.util.CollectorStreamObserver;
import recordkvs.util.GenericResponseCollector;

/**
 * Example driver that walks through the four interaction patterns of the record service.
 * Usage: {@code RecordClient [host:port]}, default {@code localhost:5000}.
 */
public class RecordClient {

	private static final Logger logger = LoggerFactory.getLogger(RecordClient.class);

	static final String DEFAULT_TARGET = "localhost:5000";
	static final long STREAM_TIMEOUT_SECONDS = 30;

	private final RecordServiceGrpc.RecordServiceBlockingStub blockingStub;
	private final RecordServiceGrpc.RecordServiceStub asyncStub;
	private final PrintStream out;

	public RecordClient(Channel channel, PrintStream out) {
		this.blockingStub = RecordServiceGrpc.newBlockingStub(channel);
		this.asyncStub = RecordServiceGrpc.newStub(channel);
		this.out = out;
	}

	public RecordKvs.Record getRecord(int id) {
		return blockingStub.getRecord(RecordKvs.GetRecordRequest.newBuilder().setId(id).build());
	}

	public RecordKvs.Record createRecord(String name, String contact, int numericAttribute) {
		return blockingStub.createRecord(newRequest(name, contact, numericAttribute));
	}

	/**
	 * Hands each record to {@code onRecord} as soon as it arrives, blocking until the stream ends.
	 */
	public void streamRecords(Consumer<RecordKvs.Record> onRecord) {
		Iterator<RecordKvs.Record> stream = blockingStub.listRecordsStream(Empty.getDefaultInstance());
		while (stream.hasNext()) {
			onRecord.accept(stream.next());
		}
	}

	public List<RecordKvs.Record> listRecords() {
		List<RecordKvs.Record> records = new ArrayList<>();
		streamRecords(records::add);
		return records;
	}

	public RecordKvs.BatchCreateResponse batchCreate(List<RecordKvs.CreateRecordRequest> requests)
			throws InterruptedException {
		GenericResponseCollector<RecordKvs.BatchCreateResponse> collector = new GenericResponseCollector<>();
		StreamObserver<RecordKvs.CreateRecordRequest> requestObserver =
				asyncStub.batchCreateRecords(new CollectorStreamObserver<>(collector));
		try {
			for (RecordKvs.CreateRecordRequest request : requests) {
				requestObserver.onNext(request);
			}
		} catch (RuntimeException e) {
			requestObserver.onError(e);
			throw e;
		}
		requestObserver.onCompleted();

		awaitCall(collector, "BatchCreateRecords");
		List<RecordKvs.BatchCreateResponse> responses = collector.getResponses();
		if (responses.isEmpty()) {
			// a stream that ends without its response is inconclusive
			throw Status.UNKNOWN.withDescription("BatchCreateRecords ended without a response").asRuntimeException();
		}
		return responses.get(0);
	}

	public void runExamples() throws InterruptedException {
		out.println("=== GetRecord Example ===");
		try {
			RecordKvs.Record record = getRecord(1);
			out.printf("Found record: %s (%s) - %d%n", record.getName(), record.getContact(),
					record.getNumericAttribute());
		} catch (StatusRuntimeException e) {
			out.println("gRPC Error: " + e.getStatus());
		}

		out.println("=== CreateRecord Example ===");
		try {
			RecordKvs.Record record = createRecord("Alice Johnson", "alice@example.com", 28);
			out.printf("Created record: %s with id %d%n", record.getName(), record.getId());
		} catch (StatusRuntimeException e) {
			out.println("gRPC Error: " + e.getStatus());
		}

		out.println("=== ListRecordsStream Example ===");
		try {
			streamRecords(record -> out.printf("Streamed record: %d - %s (%s)%n", record.getId(), record.getName(),
					record.getContact()));
		} catch (StatusRuntimeException e) {
			out.println("gRPC Error: " + e.getStatus());
		}

		out.println("=== BatchCreateRecords Example ===");
		try {
			RecordKvs.BatchCreateResponse response = batchCreate(List.of(
					newRequest("Bob Wilson", "bob@example.com", 35),
					newRequest("Carol Brown", "carol@example.com", 29),
					newRequest("David Lee", "david@example.com", 42)));
			out.printf("Batch created %d records%n", response.getCreatedCount());
			for (RecordKvs.Record record : response.getRecordsList()) {
				out.printf("  - %s (id %d)%n", record.getName(), record.getId());
			}
		} catch (StatusRuntimeException e) {
			out.println("gRPC Error: " + e.getStatus());
		}
	}

	static RecordKvs.CreateRecordRequest newRequest(String name, String contact, int numericAttribute) {
		return RecordKvs.CreateRecordRequest.newBuilder()
				.setName(name)
				.setContact(contact)
				.setNumericAttribute(numericAttribute)
				.build();
	}

	private static <T> void awaitCall(GenericResponseCollector<T> collector, String method)
			throws InterruptedException {
		if (!collector.waitForCompletion(STREAM_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
			throw Status.DEADLINE_EXCEEDED
					.withDescription(method + " did not finish within " + STREAM_TIMEOUT_SECONDS + "s")
					.asRuntimeException();
		}
		if (collector.getError() != null) {
			throw Status.fromThrowable(collector.getError()).asRuntimeException();
		}
	}

	public static void main(String[] args) throws Exception {
		String target = args.length > 0 ? args[0] : DEFAULT_TARGET;
		ManagedChannel channel = ManagedChannelBuilder.forTarget(target).usePlaintext().build();
		logger.info("Connecting to record server at {}", target);
		try {
			new RecordClient(channel, System.out).runExamples();
			System.out.println("All examples completed");
		} finally {
			channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
		}
	}
}
