package recordkvs.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import recordkvs.util.PacingMode;

public class RecordServerState {

	private static final Logger logger = LoggerFactory.getLogger(RecordServerState.class);

	int port;
	RecordStore store;
	PacingMode pacing_mode;

	public RecordServerState(RecordServerConfig config) {
		this(config, new RecordStore());
	}

	public RecordServerState(RecordServerConfig config, RecordStore store) {
		this.port = config.getPort();
		this.store = store;
		this.pacing_mode = new PacingMode(config.getPauseMillis());
		if (config.isSeedStore()) {
			seedStore();
		}
	}

	// the two sample records, only into an empty store
	public void seedStore() {
		synchronized (store) {
			if (store.size() > 0) {
				logger.debug("Store already holds {} records, not seeding", store.size());
				return;
			}
			store.create("John Doe", "john@example.com", 30);
			store.create("Jane Smith", "jane@example.com", 25);
		}
		logger.info("Seeded store with {} records", store.size());
	}

	public RecordStore getStore() {
		return this.store;
	}

	public PacingMode getPacingMode() {
		return this.pacing_mode;
	}

	public int getPort() {
		return this.port;
	}
}
