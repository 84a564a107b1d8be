package io.pulsereader.ingestion.config;

/**
 * Operation budget for one pipeline run.
 *
 * @param ceiling         maximum number of external calls a run may issue
 * @param finalizeReserve units kept back while sources are processed so the
 *                        closing source update can still be issued
 */
public record BudgetConfig(
        int ceiling,
        int finalizeReserve
) {
    public BudgetConfig {
        if (ceiling < 0) {
            throw new IllegalArgumentException("Budget ceiling must not be negative: " + ceiling);
        }
        if (finalizeReserve < 0 || finalizeReserve > ceiling) {
            throw new IllegalArgumentException("Finalize reserve must be within [0, ceiling]: " + finalizeReserve);
        }
    }
}
