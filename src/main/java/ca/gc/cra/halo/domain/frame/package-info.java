/**
 * Frame and region value types shared by capture, detection and rendering.
 */
package ca.gc.cra.halo.domain.frame;
