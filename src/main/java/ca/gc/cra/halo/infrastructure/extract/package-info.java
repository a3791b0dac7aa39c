/**
 * Pure-Java feature extraction over frame pixels.
 */
package ca.gc.cra.halo.infrastructure.extract;
