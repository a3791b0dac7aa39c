/**
 * Single-shot countdown capture: state machine, best-frame reducer and the session use case.
 */
package ca.gc.cra.halo.application.session;
