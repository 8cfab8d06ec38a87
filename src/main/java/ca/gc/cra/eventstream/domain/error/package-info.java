/**
 * Checked failure taxonomy shared by the subscription core, its ports, and the CLI.
 */
package ca.gc.cra.eventstream.domain.error;
