/**
 * Checked exception taxonomy shared by ports and adapters.
 */
package ca.gc.cra.halo.domain.error;
