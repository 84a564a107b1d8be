package io.pulsereader.ingestion.api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts external calls issued during one run against a fixed ceiling.
 * <p>
 * A part of the ceiling can be held back while sources are processed so the
 * closing source update always has room; {@link #releaseHeld()} makes it
 * spendable. Not thread-safe: a tracker belongs to exactly one run.
 */
public class BudgetTracker {

    private static final Logger logger = LoggerFactory.getLogger(BudgetTracker.class);

    private final int ceiling;
    private int held;
    private int used;

    public BudgetTracker(int ceiling, int held) {
        if (ceiling < 0 || held < 0 || held > ceiling) {
            throw new IllegalArgumentException(
                    "Invalid budget: ceiling=" + ceiling + ", held=" + held);
        }
        this.ceiling = ceiling;
        this.held = held;
    }

    /**
     * @return whether {@code n} more operations fit under the ceiling minus the held-back part
     */
    public boolean reserve(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot reserve a negative amount: " + n);
        }
        return used + n <= ceiling - held;
    }

    public void consume(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot consume a negative amount: " + n);
        }
        used += n;
        if (used > ceiling) {
            logger.warn("Operation budget overrun: {} used of {}", used, ceiling);
        }
    }

    public void releaseHeld() {
        held = 0;
    }

    public int remaining() {
        return Math.max(0, ceiling - held - used);
    }

    public int used() {
        return used;
    }

    public int ceiling() {
        return ceiling;
    }
}
