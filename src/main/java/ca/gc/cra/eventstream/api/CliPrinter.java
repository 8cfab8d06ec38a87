package ca.gc.cra.eventstream.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Console output for usage text, dry-run plans, and preflight summaries.
 *
 * <p>Writes to the stdout file descriptor directly so CLI output stays separate from log appenders.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TARGET = new AtomicReference<>(STDOUT);

  private CliPrinter() {}

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    TARGET.get().println(message);
  }

  /**
   * Prints zero or more lines.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = TARGET.get();
    for (String line : lines) {
      out.println(line);
    }
  }

  /**
   * Prints a heading followed by one {@code label : value} row per entry, labels padded to the widest.
   *
   * @param heading first line
   * @param rows rows in display order
   */
  public static void printTable(String heading, Map<String, ?> rows) {
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter out = TARGET.get();
    out.println(heading);
    for (Map.Entry<String, ?> row : rows.entrySet()) {
      out.println(String.format(" %-" + width + "s : %s", row.getKey(), row.getValue()));
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    TARGET.set(writer == null ? STDOUT : writer);
  }

  static void clearTestWriter() {
    TARGET.set(STDOUT);
  }
}
