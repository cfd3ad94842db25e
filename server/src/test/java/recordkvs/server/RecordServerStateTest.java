package recordkvs.server;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RecordServerStateTest {

    @Test
    void seedsTheTwoSampleRecords() {
        RecordServerState state = new RecordServerState(config("true", "0"));

        RecordStore store = state.getStore();
        assertEquals(2, store.size());
        assertEquals("John Doe", store.get(1).getName());
        assertEquals("jane@example.com", store.get(2).getContact());
        assertEquals(25, store.get(2).getNumericAttribute());
    }

    @Test
    void seedingCanBeSwitchedOff() {
        RecordServerState state = new RecordServerState(config("false", "0"));

        assertEquals(0, state.getStore().size());
    }

    @Test
    void doesNotSeedANonEmptyStore() {
        RecordStore store = new RecordStore();
        store.create("Existing", "e@e", 1);

        new RecordServerState(config("true", "0"), store);

        assertEquals(1, store.size());
    }

    @Test
    void pacingComesFromTheConfig() {
        RecordServerState state = new RecordServerState(config("false", "42"));

        assertEquals(42, state.getPacingMode().getPauseMillis());
    }

    static RecordServerConfig config(String seed, String pauseMillis) {
        Properties properties = new Properties();
        properties.setProperty(RecordServerConfig.PORT_KEY, "0");
        properties.setProperty(RecordServerConfig.PAUSE_KEY, pauseMillis);
        properties.setProperty(RecordServerConfig.SEED_KEY, seed);
        return new RecordServerConfig(properties);
    }
}
