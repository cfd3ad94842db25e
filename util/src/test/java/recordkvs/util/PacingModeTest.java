package recordkvs.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PacingModeTest {

    @Test
    void zeroPauseReturnsImmediately() {
        PacingMode pacing = new PacingMode(0);

        assertTrue(pacing.pause());
    }

    @Test
    void pauseSleepsForTheConfiguredTime() {
        PacingMode pacing = new PacingMode(30);

        long start = System.nanoTime();
        assertTrue(pacing.pause());
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMillis >= 25, "slept " + elapsedMillis + " ms");
    }

    @Test
    void interruptedPauseReportsFalseAndKeepsTheFlag() {
        PacingMode pacing = new PacingMode(10_000);

        Thread.currentThread().interrupt();
        try {
            assertFalse(pacing.pause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNegativePause() {
        PacingMode pacing = new PacingMode(5);

        assertThrows(IllegalArgumentException.class, () -> pacing.setPauseMillis(-1));
        assertEquals(5, pacing.getPauseMillis());
    }
}
