/**
 * Runtime logging controls for the CLI.
 */
package ca.gc.cra.halo.logging;
