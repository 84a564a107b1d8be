package io.pulsereader.ingestion.api.service;

import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Inserts the pauses between sources and between individual fallback calls.
 */
@Component
public class Pacer {

    /**
     * @return {@code false} if the thread was interrupted while waiting
     */
    public boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
