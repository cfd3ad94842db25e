package recordkvs.server;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RecordServerConfigTest {

    @Test
    void emptyPropertiesUseDefaults() {
        RecordServerConfig config = new RecordServerConfig(new Properties());

        assertEquals(5000, config.getPort());
        assertEquals(100, config.getPauseMillis());
        assertTrue(config.isSeedStore());
    }

    @Test
    void loadsTheBundledProperties() {
        RecordServerConfig config = RecordServerConfig.load();

        assertEquals(5000, config.getPort());
        assertEquals(100, config.getPauseMillis());
        assertTrue(config.isSeedStore());
    }

    @Test
    void missingResourceFallsBackToDefaults() {
        RecordServerConfig config = RecordServerConfig.load("no-such-file.properties");

        assertEquals(5000, config.getPort());
    }

    @Test
    void argumentsOverrideTheFile() {
        Properties properties = new Properties();
        properties.setProperty(RecordServerConfig.PORT_KEY, "6000");
        properties.setProperty(RecordServerConfig.SEED_KEY, "false");
        RecordServerConfig base = new RecordServerConfig(properties);

        RecordServerConfig config = base.withArgs(new String[] {"7000", "0"});

        assertEquals(7000, config.getPort());
        assertEquals(0, config.getPauseMillis());
        assertFalse(config.isSeedStore());
        assertEquals(6000, base.getPort());
    }

    @Test
    void invalidNumbersNameTheKey() {
        Properties properties = new Properties();
        properties.setProperty(RecordServerConfig.PAUSE_KEY, "soon");
        RecordServerConfig config = new RecordServerConfig(properties);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::getPauseMillis);
        assertTrue(e.getMessage().contains(RecordServerConfig.PAUSE_KEY));
    }

    @Test
    void rejectsOutOfRangePortAndNegativePause() {
        RecordServerConfig config = new RecordServerConfig(new Properties()).withArgs(new String[] {"70000", "-5"});

        assertThrows(IllegalArgumentException.class, config::getPort);
        assertThrows(IllegalArgumentException.class, config::getPauseMillis);
    }
}
