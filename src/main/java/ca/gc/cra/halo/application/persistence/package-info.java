/**
 * Unbounded result queue and the interval-driven batching flusher.
 */
package ca.gc.cra.halo.application.persistence;
