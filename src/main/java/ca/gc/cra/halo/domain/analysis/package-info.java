/**
 * Measurement and indicator value types produced by the analysis pipeline.
 */
package ca.gc.cra.halo.domain.analysis;
