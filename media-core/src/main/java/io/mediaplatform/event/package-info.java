/**
 * Domain events and their outbox payload format.
 */
package io.mediaplatform.event;
