/**
 * Concurrency helpers shared by application use cases.
 */
package ca.gc.cra.eventstream.application.util;
