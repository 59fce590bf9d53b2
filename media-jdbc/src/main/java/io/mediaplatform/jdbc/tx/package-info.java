/**
 * Explicit JDBC transactions for the media write path.
 */
package io.mediaplatform.jdbc.tx;
