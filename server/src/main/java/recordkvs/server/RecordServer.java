package recordkvs.server;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RecordServer {

	private static final Logger logger = LoggerFactory.getLogger(RecordServer.class);

	private final RecordServerState server_state;
	private Server server;

	public RecordServer(RecordServerState state) {
		this.server_state = state;
	}

	public void start() throws IOException {
		server = ServerBuilder.forPort(server_state.getPort())
				.addService(new RecordServiceImpl(server_state))
				.build()
				.start();
		logger.info("Record server started, listening on port {}", server.getPort());
	}

	public void stop() throws InterruptedException {
		if (server != null) {
			server.shutdown();
			if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("Record server did not terminate in time, forcing shutdown");
				server.shutdownNow();
			}
		}
	}

	public void blockUntilShutdown() throws InterruptedException {
		if (server != null) {
			server.awaitTermination();
		}
	}

	public int getPort() {
		if (server == null) {
			throw new IllegalStateException("Server not started");
		}
		return server.getPort();
	}

	public static void main(String[] args) throws Exception {
		RecordServerConfig config = RecordServerConfig.load().withArgs(args);
		RecordServer recordServer = new RecordServer(new RecordServerState(config));
		recordServer.start();

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			logger.info("Shutting down record server");
			try {
				recordServer.stop();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}));

		recordServer.blockUntilShutdown();
	}
}
