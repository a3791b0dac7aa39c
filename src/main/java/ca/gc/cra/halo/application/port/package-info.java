/**
 * Ports through which the HALO pipeline reaches devices, analysis collaborators, storage and
 * telemetry.
 */
package ca.gc.cra.halo.application.port;
