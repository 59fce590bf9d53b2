/**
 * Outbox records and the scheduled publisher that delivers them.
 *
 * @see io.mediaplatform.outbox.OutboxPublisher
 */
package io.mediaplatform.outbox;
