/**
 * Media aggregate, its status state machine and the domain errors surfaced to callers.
 */
package io.mediaplatform.domain;
