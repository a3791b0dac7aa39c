/**
 * Heuristic indicator scoring.
 */
package ca.gc.cra.halo.infrastructure.score;
