package ca.gc.cra.rackd.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes usage text, dry-run plans and scan summaries to standard output.
 *
 * <p>Logback owns stderr, so {@code rackd scan ... > summary.txt} captures only the summary.</p>
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TARGET = new AtomicReference<>(CONSOLE);

  private CliPrinter() {}

  public static void println(String message) {
    printLines(message);
  }

  /** Emits each line in order and flushes once; a {@code null} array prints nothing. */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = TARGET.get();
    Arrays.stream(lines).forEach(out::println);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    TARGET.set(Objects.requireNonNull(writer, "writer"));
  }

  static void clearTestWriter() {
    TARGET.set(CONSOLE);
  }
}
