/**
 * Internal helpers: thread factory and the flat JSON codec.
 */
package io.mediaplatform.util;
