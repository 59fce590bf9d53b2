/**
 * Extension points the core depends on: connections, transactions, media and
 * outbox persistence, and publisher metrics.
 *
 * @see io.mediaplatform.spi.TransactionManager
 * @see io.mediaplatform.spi.OutboxStore
 * @see io.mediaplatform.spi.MetricsExporter
 */
package io.mediaplatform.spi;
