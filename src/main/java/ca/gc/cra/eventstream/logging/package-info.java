/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep secrets out of log output.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> Provides redaction helpers used by {@code Credentials} and the CLI dry-run plan.
 *
 * @since 0.1.0
 */
package ca.gc.cra.eventstream.logging;
