package io.mediaplatform.spi;

import io.mediaplatform.event.DomainEvent;
import io.mediaplatform.outbox.OutboxRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Durable queue of events waiting to be delivered to the broker.
 *
 * <p>All methods receive an explicit {@link Connection}. {@link #enqueue} must run on
 * the connection of the transaction that performs the matching state change.
 * Implementations live in the {@code media-jdbc} module.
 */
public interface OutboxStore {

    /**
     * Serializes the event and inserts it as a pending record.
     *
     * @param conn  the transaction's connection
     * @param event the event to enqueue
     * @throws io.mediaplatform.event.EventSerializationException if the event cannot be serialized
     * @throws StoreException                                     if the insert fails
     */
    void enqueue(Connection conn, DomainEvent event);

    /**
     * Returns up to {@code limit} records whose {@code processed_at} is null,
     * in ascending id order.
     */
    List<OutboxRecord> fetchPending(Connection conn, int limit);

    /**
     * Sets {@code processed_at} on one pending record.
     *
     * @return 1 if the record was marked, 0 if it was already processed or does not exist
     */
    int markProcessed(Connection conn, long id);

    /**
     * Claims pending records for one publisher instance so that concurrent
     * instances do not deliver the same rows at the same time. Records claimed by
     * another owner are skipped until their claim is older than {@code lockExpiry}.
     *
     * <p>Defaults to {@link #fetchPending} without locking. Must run inside a
     * transaction when overridden.
     *
     * @param conn       the JDBC connection
     * @param ownerId    identifier of the claiming publisher
     * @param now        claim timestamp
     * @param lockExpiry claims older than this are considered abandoned
     * @param limit      maximum number of records to claim
     * @return claimed records in ascending id order
     */
    default List<OutboxRecord> claimPending(
            Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
        return fetchPending(conn, limit);
    }
}
