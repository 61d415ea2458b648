package ca.gc.cra.logmerge.infrastructure.output;

import ca.gc.cra.logmerge.application.port.DuplicateReportPort;
import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.AdifTags;
import ca.gc.cra.logmerge.domain.dedup.DuplicateEvent;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders duplicate events as a self-contained HTML page, {@code dupe_report.html}, so operators can check what the
 * merge removed. Each row shows the removed record next to the kept one. Every value is HTML-escaped.
 *
 * @since 0.1.0
 */
public final class HtmlDuplicateReportAdapter implements DuplicateReportPort {
  /** Report file name inside the output directory. */
  public static final String FILE_NAME = "dupe_report.html";

  private static final DateTimeFormatter GENERATED =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private final Path outputDirectory;

  /**
   * Creates a report adapter.
   *
   * @param outputDirectory directory receiving {@value #FILE_NAME}
   */
  public HtmlDuplicateReportAdapter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public void publish(List<DuplicateEvent> events, Instant generatedAt) throws IOException {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(generatedAt, "generatedAt");
    Files.createDirectories(outputDirectory);
    try (BufferedWriter out = Files.newBufferedWriter(outputDirectory.resolve(FILE_NAME), StandardCharsets.UTF_8)) {
      out.write("""
          <!DOCTYPE html>
          <html lang="en">
          <head>
          <meta charset="UTF-8">
          <title>Duplicate contacts</title>
          <style>
          body { font-family: sans-serif; margin: 2em; }
          table { border-collapse: collapse; width: 100%; }
          th, td { border: 1px solid #ccc; padding: 4px 8px; text-align: left; vertical-align: top; }
          th { background: #eee; }
          td.removed { background: #fdecea; }
          td.kept { background: #e8f5e9; }
          </style>
          </head>
          <body>
          """);
      out.write("<h1>Duplicate contacts</h1>\n");
      out.write("<p>Generated " + escape(GENERATED.format(generatedAt)) + ". Removed records: "
          + events.size() + ".</p>\n");
      if (events.isEmpty()) {
        out.write("<p>No duplicates found.</p>\n");
      } else {
        out.write("<table>\n<tr><th>#</th><th>Group</th><th>Removed</th><th>Kept</th></tr>\n");
        int index = 1;
        for (DuplicateEvent event : events) {
          out.write("<tr><td>" + index++ + "</td><td>" + escape(event.groupKey()) + "</td>"
              + "<td class=\"removed\">" + describe(event.incoming()) + "</td>"
              + "<td class=\"kept\">" + describe(event.existing()) + "</td></tr>\n");
        }
        out.write("</table>\n");
      }
      out.write("</body>\n</html>\n");
    }
  }

  private static String describe(AdifRecord record) {
    return "<b>" + escape(record.getOrEmpty(AdifTags.CALL)) + "</b> "
        + escape(record.getOrEmpty(AdifTags.BAND)) + ' '
        + escape(record.getOrEmpty(AdifTags.MODE)) + "<br>"
        + escape(record.getOrEmpty(AdifTags.QSO_DATE)) + ' '
        + escape(record.getOrEmpty(AdifTags.TIME_ON)) + "<br>"
        + "<small>" + escape(record.source()) + "</small>";
  }

  static String escape(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '&' -> sb.append("&amp;");
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#39;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
