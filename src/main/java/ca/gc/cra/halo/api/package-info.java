/**
 * Command-line entry points: {@code live}, {@code session} and {@code view}.
 */
package ca.gc.cra.halo.api;
