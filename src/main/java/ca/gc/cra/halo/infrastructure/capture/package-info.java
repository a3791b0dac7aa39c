/**
 * OpenCV-backed capture adapters.
 */
package ca.gc.cra.halo.infrastructure.capture;
