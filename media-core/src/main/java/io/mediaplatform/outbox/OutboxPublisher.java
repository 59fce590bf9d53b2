package io.mediaplatform.outbox;

import io.mediaplatform.producer.MessageProducer;
import io.mediaplatform.producer.PublishException;
import io.mediaplatform.spi.ConnectionProvider;
import io.mediaplatform.spi.MetricsExporter;
import io.mediaplatform.spi.OutboxStore;
import io.mediaplatform.util.DaemonThreadFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background task that drains the outbox into the broker with at-least-once semantics.
 *
 * <p>Every {@code interval} it fetches up to {@code batchSize} pending records in id
 * order and publishes each one through the {@link MessageProducer}, keyed by event id.
 * A record whose publish fails stays pending and the tick moves on to the next one.
 * A record that was published but could not be marked processed is published again
 * on a later tick. Consumers deduplicate by event id.
 *
 * <p>Operates in two modes:
 * <ul>
 *   <li><b>Single instance</b> (default): plain {@link OutboxStore#fetchPending}.
 *   <li><b>Claim locking</b>: {@link OutboxStore#claimPending} so several instances can
 *       share one table. Enabled via {@link Builder#claimLocking}.
 * </ul>
 *
 * <p>Tick failures are logged and never stop the schedule. {@link #close()} interrupts
 * a running tick, which ends after the record being published.
 *
 * <p>This class is thread-safe. {@link #start()} and {@link #close()} are synchronized.
 */
public final class OutboxPublisher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(OutboxPublisher.class.getName());

    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;
    private final MessageProducer producer;
    private final int batchSize;
    private final Duration interval;
    private final MetricsExporter metrics;
    private final String ownerId;
    private final Duration lockTimeout;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean closed;

    private OutboxPublisher(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
        this.producer = Objects.requireNonNull(builder.producer, "producer");
        Objects.requireNonNull(builder.interval, "interval");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + builder.batchSize);
        }
        if (builder.interval.isNegative() || builder.interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + builder.interval);
        }

        this.batchSize = builder.batchSize;
        this.interval = builder.interval;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.ownerId = builder.ownerId;
        this.lockTimeout = builder.lockTimeout;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the schedule. The first tick runs after one interval. Subsequent calls are no-ops.
     *
     * @throws IllegalStateException if the publisher has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("OutboxPublisher has been closed");
        }
        if (tickTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outbox-publisher-"));
        long intervalMs = interval.toMillis();
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Outbox publisher started: interval={0} ms, batchSize={1}, claimOwner={2}",
            new Object[] {intervalMs, batchSize, ownerId == null ? "none" : ownerId});
    }

    /**
     * Runs one fetch-publish-mark cycle. Called by the scheduler, and directly by tests.
     *
     * @return counts for this tick; {@link TickResult#aborted()} is set when the tick failed
     */
    public TickResult tick() {
        if (closed) {
            return TickResult.EMPTY;
        }
        try {
            Instant now = clock.instant();
            List<OutboxRecord> records = fetchPending(now);
            if (records.isEmpty()) {
                metrics.recordOldestLagMs(0);
                logger.finest("No pending outbox records");
                return TickResult.EMPTY;
            }
            Instant oldest = records.get(0).occurredAt();
            if (oldest != null) {
                metrics.recordOldestLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
            }
            return publishAll(records);
        } catch (Throwable t) {
            metrics.incrementTickFailed();
            logger.log(Level.SEVERE, "Outbox tick failed", t);
            return TickResult.ABORTED;
        }
    }

    private List<OutboxRecord> fetchPending(Instant now) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            if (ownerId != null) {
                // claim (UPDATE then SELECT) must run in one transaction
                conn.setAutoCommit(false);
                try {
                    List<OutboxRecord> claimed =
                        outboxStore.claimPending(conn, ownerId, now, now.minus(lockTimeout), batchSize);
                    conn.commit();
                    return claimed;
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
            }
            conn.setAutoCommit(true);
            return outboxStore.fetchPending(conn, batchSize);
        }
    }

    private TickResult publishAll(List<OutboxRecord> records) {
        int published = 0;
        int failed = 0;
        int marked = 0;
        for (OutboxRecord record : records) {
            if (closed || Thread.currentThread().isInterrupted()) {
                logger.info("Outbox publisher stopping, abandoning the rest of the batch");
                break;
            }
            try {
                producer.publish(record.eventId(), record.payload().getBytes(StandardCharsets.UTF_8));
            } catch (PublishException e) {
                failed++;
                metrics.incrementPublishFailed();
                logger.log(Level.WARNING, "Failed to publish outbox record id=" + record.id()
                    + " eventId=" + record.eventId() + " (" + e.reason() + "), leaving it pending", e);
                if (e.reason() == PublishException.Reason.CANCELLED || e.reason() == PublishException.Reason.CLOSED) {
                    break;
                }
                continue;
            }
            published++;
            if (markProcessed(record)) {
                marked++;
                metrics.incrementPublished();
            } else {
                metrics.incrementMarkFailed();
            }
        }

        TickResult result = new TickResult(records.size(), published, failed, marked, false);
        logger.log(Level.INFO, "Outbox batch processed: total={0} published={1} failed={2} marked={3}",
            new Object[] {records.size(), published, failed, marked});
        return result;
    }

    private boolean markProcessed(OutboxRecord record) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            outboxStore.markProcessed(conn, record.id());
            return true;
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Published outbox record id=" + record.id() + " eventId=" + record.eventId()
                + " but failed to mark it processed; it will be published again", e);
            return false;
        }
    }

    /**
     * Stops the schedule, interrupting a running tick, and waits up to 5 seconds for it
     * to end. Does not close the producer.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warning("Outbox publisher thread did not stop within 5 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Outbox publisher stopped");
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Builder for {@link OutboxPublisher}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxStore outboxStore;
        private MessageProducer producer;
        private int batchSize = 100;
        private Duration interval = Duration.ofSeconds(5);
        private MetricsExporter metrics;
        private String ownerId;
        private Duration lockTimeout;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b> Source of connections for fetching and marking records.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder outboxStore(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        /**
         * <b>Required.</b> The producer records are published through. The publisher
         * does not close it.
         */
        public Builder producer(MessageProducer producer) {
            this.producer = producer;
            return this;
        }

        /**
         * Maximum records handled per tick.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Delay between the end of one tick and the start of the next.
         *
         * <p>Optional. Defaults to 5 seconds. Must be positive.
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Enables claim locking with a generated owner id.
         *
         * @param lockTimeout how long a claim holds before another instance may take the record over
         */
        public Builder claimLocking(Duration lockTimeout) {
            return claimLocking("publisher-" + UUID.randomUUID().toString().substring(0, 8), lockTimeout);
        }

        /**
         * Enables claim locking so several publisher instances can share one outbox table.
         *
         * @param ownerId     unique id of this instance (e.g. hostname or pod name)
         * @param lockTimeout how long a claim holds before another instance may take the record over
         */
        public Builder claimLocking(String ownerId, Duration lockTimeout) {
            this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            if (ownerId.isBlank()) {
                throw new IllegalArgumentException("ownerId cannot be blank");
            }
            if (lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be positive");
            }
            return this;
        }

        /**
         * Optional. Clock used for lag and claim timestamps. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if {@code batchSize <= 0} or {@code interval} is not positive
         */
        public OutboxPublisher build() {
            return new OutboxPublisher(this);
        }
    }
}
