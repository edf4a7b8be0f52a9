package ca.gc.cra.sconv.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for CLI text and converted bytes.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple stdout writes that play nicely with logging configurations.</p>
 */
public final class CliPrinter {
  private static final OutputStream STDOUT_BYTES = new FileOutputStream(FileDescriptor.out);
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(STDOUT_BYTES, StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;
  private static volatile OutputStream bytesOverride;

  private CliPrinter() {
    // Utility
  }

  /** Prints a single line to stdout using the shared CLI writer. */
  public static void println(String message) {
    writer().println(message);
  }

  /** Prints zero or more lines to stdout using the shared CLI writer. */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Writes raw bytes to stdout, bypassing the UTF-8 writer. Converted text is already in its target
   * charset.
   *
   * @throws IOException when stdout cannot be written
   */
  public static void writeBytes(byte[] bytes, int offset, int length) throws IOException {
    writer().flush();
    OutputStream out = bytesOverride != null ? bytesOverride : STDOUT_BYTES;
    out.write(bytes, offset, length);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void setBytesForTesting(OutputStream out) {
    bytesOverride = out;
  }

  static void clearTestWriter() {
    override = null;
    bytesOverride = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
