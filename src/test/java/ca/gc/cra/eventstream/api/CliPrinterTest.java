package ca.gc.cra.eventstream.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
  private final StringWriter buffer = new StringWriter();

  @AfterEach
  void restoreStdout() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void padsLabelsToWidestRow() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Topics", "/event/A");
    rows.put("Replay preset", "LATEST");

    CliPrinter.printTable("Plan:", rows);

    String nl = System.lineSeparator();
    assertEquals("Plan:" + nl
        + " Topics        : /event/A" + nl
        + " Replay preset : LATEST" + nl, buffer.toString());
  }
}
