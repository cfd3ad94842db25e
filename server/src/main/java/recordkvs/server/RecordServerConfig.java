package recordkvs.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server settings, read from {@value #RESOURCE} on the classpath. Positional command-line
 * arguments override the file: {@code <port> [pauseMillis]}.
 */
public final class RecordServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(RecordServerConfig.class);

    public static final String RESOURCE = "recordserver.properties";
    public static final String PORT_KEY = "server.port";
    public static final String PAUSE_KEY = "stream.pause.millis";
    public static final String SEED_KEY = "store.seed";

    static final int DEFAULT_PORT = 5000;
    static final long DEFAULT_PAUSE_MILLIS = 100;

    private final Properties properties;

    public RecordServerConfig(Properties properties) {
        this.properties = properties;
    }

    public static RecordServerConfig load() {
        return load(RESOURCE);
    }

    public static RecordServerConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = RecordServerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.warn("{} not found on the classpath, using defaults", resource);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
        return new RecordServerConfig(properties);
    }

    public RecordServerConfig withArgs(String[] args) {
        Properties merged = new Properties();
        merged.putAll(properties);
        if (args.length > 0) {
            merged.setProperty(PORT_KEY, args[0]);
        }
        if (args.length > 1) {
            merged.setProperty(PAUSE_KEY, args[1]);
        }
        return new RecordServerConfig(merged);
    }

    public int getPort() {
        long port = longValue(PORT_KEY, DEFAULT_PORT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(PORT_KEY + " out of range: " + port);
        }
        return (int) port;
    }

    public long getPauseMillis() {
        long pause = longValue(PAUSE_KEY, DEFAULT_PAUSE_MILLIS);
        if (pause < 0) {
            throw new IllegalArgumentException(PAUSE_KEY + " must not be negative: " + pause);
        }
        return pause;
    }

    public boolean isSeedStore() {
        return Boolean.parseBoolean(properties.getProperty(SEED_KEY, "true").trim());
    }

    private long longValue(String key, long def) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return def;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
