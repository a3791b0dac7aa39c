/**
 * Argument validation shared by configuration parsing and settings records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.halo.validation;
