package ca.gc.cra.swarm.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes user-facing CLI output (help, dry-run plans, run summaries) to standard output.
 *
 * <p>Logging goes through SLF4J; only results meant for the operator are printed here. Tests can redirect the
 * output with {@link #setWriterForTesting(PrintWriter)}.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message text to print
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a titled block of {@code label : value} rows with the labels padded to a common width.
   *
   * @param title first line of the block
   * @param rows rows in display order
   */
  public static void printSection(String title, Map<String, String> rows) {
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter writer = writer();
    writer.println(title);
    for (Map.Entry<String, String> row : rows.entrySet()) {
      writer.println(" " + pad(row.getKey(), width) + " : " + row.getValue());
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String pad(String label, int width) {
    StringBuilder padded = new StringBuilder(width);
    padded.append(label);
    while (padded.length() < width) {
      padded.append(' ');
    }
    return padded.toString();
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
