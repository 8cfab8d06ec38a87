/**
 * Downstream pipeline host binding the relay's receiver to its exporters.
 */
package ca.gc.cra.eventstream.application.pipeline;
