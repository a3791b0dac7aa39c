/**
 * Display adapters: a JavaCV canvas window and a headless console stand-in.
 */
package ca.gc.cra.halo.infrastructure.display;
