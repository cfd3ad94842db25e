package recordkvs.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artificial pause between the messages of an outbound stream, so that staggered
 * delivery can be observed by the client. A pause of zero disables it.
 */
public class PacingMode {

    private static final Logger logger = LoggerFactory.getLogger(PacingMode.class);

    private long pauseMillis;

    public PacingMode(long pauseMillis) {
        setPauseMillis(pauseMillis);
    }

    public synchronized long getPauseMillis() {
        return pauseMillis;
    }

    public synchronized void setPauseMillis(long pauseMillis) {
        if (pauseMillis < 0) {
            throw new IllegalArgumentException("Pause must not be negative: " + pauseMillis);
        }
        this.pauseMillis = pauseMillis;
    }

    /**
     * Sleeps for the configured pause. The lock is not held while sleeping.
     *
     * @return {@code false} if the thread was interrupted; the interrupt flag is restored
     */
    public boolean pause() {
        long millis = getPauseMillis();
        if (millis == 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Pause interrupted after requesting {} ms", millis);
            return false;
        }
    }
}
