package ca.gc.cra.sentinel.infrastructure.report;

import ca.gc.cra.sentinel.application.pipeline.BatchResult;
import ca.gc.cra.sentinel.application.pipeline.BatchStatistics;
import ca.gc.cra.sentinel.application.pipeline.FileAnalysisResult;
import ca.gc.cra.sentinel.domain.issue.Issue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link BatchResult} as a single JSON document for downstream reporting tools.
 * <p>Layout: {@code batchId}, {@code complete}, {@code statistics}, {@code files[]} (each with
 * {@code issues[]}, {@code stats} and an optional {@code error}) and {@code notices[]}.</p>
 *
 * @since 0.1.0
 */
public final class JsonBatchReportWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final boolean pretty;

  public JsonBatchReportWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Writes the report to {@code out}; the writer is flushed but not closed.
   *
   * @param result batch to serialize
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(BatchResult result, Writer out) throws IOException {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(out, "out");
    JsonGenerator gen = jsonFactory.createGenerator(out);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    if (pretty) {
      gen.useDefaultPrettyPrinter();
    }
    try (gen) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("batchId", result.batchId());
      gen.writeBooleanField("complete", result.complete());
      writeStatistics(gen, result.statistics());
      gen.writeArrayFieldStart("files");
      for (FileAnalysisResult file : result.files()) {
        writeFile(gen, file);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("notices");
      for (String notice : result.incompleteNotices()) {
        gen.writeString(notice);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    out.flush();
  }

  /**
   * Renders the report as a string.
   *
   * @param result batch to serialize
   * @return JSON text
   */
  public String toJson(BatchResult result) {
    StringWriter out = new StringWriter();
    try {
      write(result, out);
    } catch (IOException ex) {
      throw new IllegalStateException("StringWriter failed", ex);
    }
    return out.toString();
  }

  private static void writeStatistics(JsonGenerator gen, BatchStatistics stats) throws IOException {
    gen.writeObjectFieldStart("statistics");
    gen.writeNumberField("tasks", stats.totalTasks());
    gen.writeNumberField("passed", stats.passed());
    gen.writeNumberField("failed", stats.failed());
    gen.writeNumberField("timedOut", stats.timedOut());
    gen.writeNumberField("crashed", stats.crashed());
    gen.writeNumberField("rejected", stats.rejected());
    gen.writeNumberField("totalDurationMillis", stats.totalDurationMillis());
    gen.writeNumberField("averageTaskMillis", stats.averageTaskMillis());
    gen.writeEndObject();
  }

  private static void writeFile(JsonGenerator gen, FileAnalysisResult file) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("path", file.filePath());
    if (file.isDegraded()) {
      gen.writeStringField("error", file.errorMessage().orElse(""));
    }
    gen.writeArrayFieldStart("issues");
    for (Issue issue : file.issues()) {
      writeIssue(gen, issue);
    }
    gen.writeEndArray();
    gen.writeObjectFieldStart("stats");
    for (Map.Entry<String, Map<String, Long>> analyzer : file.stats().entrySet()) {
      gen.writeObjectFieldStart(analyzer.getKey());
      for (Map.Entry<String, Long> counter : analyzer.getValue().entrySet()) {
        gen.writeNumberField(counter.getKey(), counter.getValue());
      }
      gen.writeEndObject();
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeIssue(JsonGenerator gen, Issue issue) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("severity", issue.severity().name());
    gen.writeStringField("type", issue.type());
    gen.writeStringField("title", issue.title());
    gen.writeStringField("message", issue.message());
    gen.writeNumberField("line", issue.line());
    gen.writeNumberField("column", issue.column());
    gen.writeStringField("analyzer", issue.analyzer());
    if (!issue.snippet().isEmpty()) {
      gen.writeStringField("snippet", issue.snippet());
    }
    if (!issue.suggestion().isEmpty()) {
      gen.writeStringField("suggestion", issue.suggestion());
    }
    gen.writeEndObject();
  }
}
