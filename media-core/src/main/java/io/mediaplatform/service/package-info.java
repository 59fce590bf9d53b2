/**
 * Service-facing API: create, read and change the status of media assets.
 */
package io.mediaplatform.service;
