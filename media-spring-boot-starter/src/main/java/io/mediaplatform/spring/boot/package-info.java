/**
 * Spring Boot auto-configuration for the media outbox.
 *
 * <p>Configure with {@code media.outbox.*} properties; see
 * {@link io.mediaplatform.spring.boot.MediaOutboxProperties}.
 */
package io.mediaplatform.spring.boot;
