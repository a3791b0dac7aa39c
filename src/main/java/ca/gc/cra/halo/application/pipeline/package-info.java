/**
 * Live pipeline: most-recent-wins frame hand-off, background analysis worker and foreground render
 * loop.
 */
package ca.gc.cra.halo.application.pipeline;
