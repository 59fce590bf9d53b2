/**
 * Micrometer bindings for the outbox publisher and the message producer.
 */
package io.mediaplatform.micrometer;
