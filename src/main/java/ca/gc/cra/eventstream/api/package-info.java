/**
 * CLI entry points for the relay: {@code stream} and {@code preflight}.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, resolves configuration, and maps startup
 * failures to exit codes.</p>
 * <p><strong>Security:</strong> Dry-run and preflight plans redact client ids, secrets, and passwords.</p>
 */
package ca.gc.cra.eventstream.api;
