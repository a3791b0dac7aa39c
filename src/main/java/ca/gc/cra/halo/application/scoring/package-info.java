/**
 * Aggregate scoring, severity proxies and recommendation rules.
 */
package ca.gc.cra.halo.application.scoring;
