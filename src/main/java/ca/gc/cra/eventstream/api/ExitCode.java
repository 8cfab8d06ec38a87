package ca.gc.cra.eventstream.api;

import ca.gc.cra.eventstream.domain.error.AuthException;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.error.EventStreamException;
import ca.gc.cra.eventstream.domain.error.PreflightException;

/**
 * Process exit codes for the relay commands.
 *
 * <p>Each startup check has its own code so supervisors can tell a bad configuration from rejected
 * credentials or an unreadable topic without parsing logs.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "ok"),
  INVALID_ARGS(2, "invalid arguments"),
  IO_ERROR(3, "configuration file unreadable"),
  CONFIG_ERROR(4, "configuration error"),
  RUNTIME_FAILURE(5, "runtime failure"),
  AUTH_ERROR(6, "authentication failed"),
  PREFLIGHT_ERROR(7, "topic preflight failed");

  private final int code;
  private final String label;

  ExitCode(int code, String label) {
    this.code = code;
    this.label = label;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Returns the short operator-facing description used in log lines.
   *
   * @return description, e.g. {@code "authentication failed"}
   */
  public String label() {
    return label;
  }

  /**
   * Maps a failure raised by a startup check to its exit code.
   *
   * <p>Steady-state failures never reach the CLI; any other subtype maps to {@link #RUNTIME_FAILURE}.</p>
   *
   * @param failure startup failure
   * @return matching exit code
   */
  public static ExitCode forStartupFailure(EventStreamException failure) {
    if (failure instanceof ConfigException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof AuthException) {
      return AUTH_ERROR;
    }
    if (failure instanceof PreflightException) {
      return PREFLIGHT_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
