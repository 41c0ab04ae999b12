package ca.gc.cra.rinex.testutil;

import ca.gc.cra.rinex.application.port.MetricsPort;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.HeaderParser;
import ca.gc.cra.rinex.domain.text.LineCursor;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Builders for fixed-column RINEX text used across tests.
 */
public final class RinexFixtures {
  private RinexFixtures() {}

  /** Loads a sample file from {@code src/test/resources/rinex}. */
  public static Path resource(String name) {
    URL url = RinexFixtures.class.getResource("/rinex/" + name);
    if (url == null) {
      throw new IllegalArgumentException("missing test resource " + name);
    }
    try {
      return Path.of(url.toURI());
    } catch (URISyntaxException ex) {
      throw new IllegalStateException(ex);
    }
  }

  public static String read(String name) {
    try {
      return Files.readString(resource(name), StandardCharsets.ISO_8859_1);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static String lines(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  public static String header(String content, String label) {
    return String.format(Locale.ROOT, "%-60s%-20s", content, label);
  }

  public static String versionLine(double version, String type, String system) {
    return header(String.format(Locale.ROOT, "%9.2f%11s%-20s%-20s", version, "", type, system),
        "RINEX VERSION / TYPE");
  }

  public static String endOfHeader() {
    return header("", "END OF HEADER");
  }

  /** Version 2 {@code # / TYPES OF OBSERV} record for up to nine codes. */
  public static String v2Types(String... codes) {
    StringBuilder content = new StringBuilder(String.format(Locale.ROOT, "%6d", codes.length));
    for (String code : codes) {
      content.append(String.format(Locale.ROOT, "%6s", code));
    }
    return header(content.toString(), "# / TYPES OF OBSERV");
  }

  /** Version 3 {@code SYS / # / OBS TYPES} record for up to thirteen codes. */
  public static String v3Types(char system, String... codes) {
    StringBuilder content = new StringBuilder(String.format(Locale.ROOT, "%c  %3d", system, codes.length));
    for (String code : codes) {
      content.append(String.format(Locale.ROOT, " %3s", code));
    }
    return header(content.toString(), "SYS / # / OBS TYPES");
  }

  /** Version 2 epoch line; satellites beyond twelve belong on continuation lines. */
  public static String v2Epoch(int yy, int month, int day, int hour, int minute, double second,
      int flag, int count, String satellites) {
    return String.format(Locale.ROOT, " %02d %2d %2d %2d %2d%11.7f  %1d%3d%s",
        yy, month, day, hour, minute, second, flag, count, satellites);
  }

  /** Continuation of a version 2 satellite list. */
  public static String v2SatelliteContinuation(String satellites) {
    return String.format(Locale.ROOT, "%32s%s", "", satellites);
  }

  public static String v3Epoch(int year, int month, int day, int hour, int minute, double second,
      int flag, int count) {
    return String.format(Locale.ROOT, "> %04d %02d %02d %02d %02d%11.7f  %1d%3d",
        year, month, day, hour, minute, second, flag, count);
  }

  /** One 16-column observation slot; {@code null} value gives a blank slot. */
  public static String slot(Double value, Integer lli, Integer ssi) {
    if (value == null) {
      return " ".repeat(16);
    }
    return String.format(Locale.ROOT, "%14.3f%s%s", value,
        lli == null ? " " : lli.toString(), ssi == null ? " " : ssi.toString());
  }

  public static String slot(double value) {
    return slot(value, null, null);
  }

  /** A D19.12 Fortran real. */
  public static String fortran(double value) {
    return String.format(Locale.ROOT, "%19.12E", value).replace('E', 'D');
  }

  /** A navigation continuation line with the given indent. */
  public static String orbitLine(int indent, double... values) {
    StringBuilder line = new StringBuilder(" ".repeat(indent));
    for (double value : values) {
      line.append(fortran(value));
    }
    return line.toString();
  }

  public static DecodeContext context(DecodeOptions options) {
    return new DecodeContext("test", options, MetricsPort.NO_OP);
  }

  /** Runs header and body parsing of one grammar over in-memory text. */
  public static HeaderMetadata run(RinexGrammar grammar, String text, DecodeContext context, RecordingSink sink)
      throws IOException, RinexDecodeException {
    try (LineCursor cursor = new LineCursor(new StringReader(text))) {
      HeaderBlock block = HeaderParser.readBlock(cursor);
      HeaderMetadata header = grammar.parseHeader(block);
      grammar.parseBody(cursor, header, context, sink);
      return header;
    }
  }
}
