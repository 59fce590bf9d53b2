package io.mediaplatform.spi;

/**
 * Observability hook for the outbox publisher.
 *
 * <p>{@link #NOOP} discards everything. The {@code media-micrometer} module bridges
 * into a Micrometer registry.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /** A record was published and marked processed. */
    void incrementPublished();

    /** Publishing a record failed terminally; it stays pending. */
    void incrementPublishFailed();

    /** A record was published but could not be marked; it will be published again. */
    void incrementMarkFailed();

    /** A whole tick failed, typically because fetching pending records failed. */
    void incrementTickFailed();

    /**
     * Records the age of the oldest record in the last fetched batch.
     *
     * @param lagMs lag in milliseconds (never negative)
     */
    void recordOldestLagMs(long lagMs);

    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementPublishFailed() {
        }

        @Override
        public void incrementMarkFailed() {
        }

        @Override
        public void incrementTickFailed() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
