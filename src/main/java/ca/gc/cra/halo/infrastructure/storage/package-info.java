/**
 * File-based result storage in JSON, CSV and XLSX layouts.
 */
package ca.gc.cra.halo.infrastructure.storage;
