/**
 * Region detector adapters.
 */
package ca.gc.cra.halo.infrastructure.detect;
