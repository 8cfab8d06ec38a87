/**
 * Configuration loading and composition root wiring for the relay CLI.
 * <p><strong>Role:</strong> Merges defaults, YAML, environment, and CLI settings into an immutable
 * {@link ca.gc.cra.eventstream.config.StreamConfig} and builds adapters from it.</p>
 * <p><strong>Security:</strong> Credentials may come from {@code SF_*} environment variables; they are
 * redacted whenever configuration is printed or logged.</p>
 */
package ca.gc.cra.eventstream.config;
