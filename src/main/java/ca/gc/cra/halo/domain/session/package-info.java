/**
 * Analysis results, status bands and the snapshot shared with the render loop.
 */
package ca.gc.cra.halo.domain.session;
