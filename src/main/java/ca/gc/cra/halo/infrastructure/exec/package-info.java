/**
 * Thread and executor construction for pipeline background tasks.
 */
package ca.gc.cra.halo.infrastructure.exec;
