/**
 * JDBC persistence for media assets.
 */
package io.mediaplatform.jdbc.media;
