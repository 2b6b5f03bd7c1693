package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.engine.PoolInitException;
import ca.gc.cra.sentinel.application.engine.PoolSettings;
import ca.gc.cra.sentinel.application.pipeline.AnalysisOrchestrator;
import ca.gc.cra.sentinel.application.pipeline.BatchResult;
import ca.gc.cra.sentinel.application.pipeline.BatchStatistics;
import ca.gc.cra.sentinel.application.pipeline.FileAnalysisResult;
import ca.gc.cra.sentinel.config.CompositionRoot;
import ca.gc.cra.sentinel.config.ConfigMerger;
import ca.gc.cra.sentinel.config.DefaultsForMode;
import ca.gc.cra.sentinel.config.EngineConfig;
import ca.gc.cra.sentinel.config.YamlConfigLoader;
import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.source.SourceFile;
import ca.gc.cra.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sentinel.infrastructure.report.JsonBatchReportWriter;
import ca.gc.cra.sentinel.logging.LoggingConfigurator;
import ca.gc.cra.sentinel.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the analyzers over a directory and prints findings, partial-result notices and task statistics.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze root=DIR [analyzers=a,b] [maxWorkers=N] [perTaskTimeoutMs=MS] "
          + "[queueCapacity=N] [batchTimeoutMs=MS] [failOn=SEVERITY] [format=text|json] [config=PATH] "
          + "[--sequential] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      SENTINEL analyze

      Usage:
        analyze root=./src [options]

      Required:
        root=DIR                     Directory to scan (default: working directory)

      Optional:
        analyzers=a,b                security, quality, bugs, performance, secrets
                                     (default security,quality,bugs,performance)
        maxWorkers=N                 Worker threads (default 4)
        perTaskTimeoutMs=MS          Per-task deadline from submission (default 60000)
        queueCapacity=N              Tasks buffered while all workers are busy (default 256)
        shutdownGraceMs=MS           Wait before force-terminating workers (default 10000)
        workerRespawnRetryBudget=N   Replacements for crashed workers (default 3)
        startupTimeoutMs=MS          Worker readiness deadline (default 10000)
        batchTimeoutMs=MS            Deadline for the whole batch (default 300000)
        failOn=SEVERITY|none         Exit 1 when a finding reaches this severity
        format=text|json             Report format on stdout (default text)
        maxFileBytes=N               Skip larger files (default 1000000)
        maxLineLength=N              Quality analyzer line limit (default 120)
        config=PATH                  YAML file with common/analyze sections
        metricsExporter=otlp|none    Metrics exporter (default none)
        otelEndpoint=URL             OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --sequential                 Submit one task at a time
        --reduce-false-positives     Run the issue post-processor
        --dry-run                    Print the plan without starting workers
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private AnalyzeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes an analysis run and maps the outcome onto an exit code.
   *
   * @param args arguments after the {@code analyze} command
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }
    List<String> unknownFlags = ConfigCliUtils.unknownFlags(input);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.isRegularFile(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.CONFIG_ERROR;
      }
      try {
        yaml = YamlConfigLoader.load(Paths.validateReadableFile(yamlPath), MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.CONFIG_ERROR;
      }
    }

    Map<String, String> defaults = DefaultsForMode.asFlatMap(MODE);
    for (String key : kv.keySet()) {
      if (!defaults.containsKey(key)) {
        log.error("Unknown argument: {}", key);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yaml, kv, defaults, log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    boolean verboseConfigured = Boolean.parseBoolean(effective.remove("verbose"));
    if (!input.verbose() && verboseConfigured) {
      LoggingConfigurator.enableVerboseLogging();
    }

    EngineConfig config;
    boolean json;
    try {
      json = ConfigCliUtils.parseFormat(effective.remove("format"));
      ConfigCliUtils.applyFlags(input, effective);
      TelemetryConfigurator.configureMetrics(effective);
      config = EngineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Paths.validateReadableDir(config.root());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid root directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      List<SourceFile> files = root.sourceProvider().load();
      if (config.dryRun()) {
        printPlan(config, files);
        return ExitCode.SUCCESS;
      }
      try (AnalysisOrchestrator orchestrator = root.orchestrator()) {
        BatchResult result = orchestrator.process(files, config.analysisOptions());
        if (json) {
          CliPrinter.println(new JsonBatchReportWriter(true).toJson(result));
        } else {
          CliPrinter.printLines(report(result));
        }
        return exitFor(result, config.failOn());
      }
    } catch (IOException ex) {
      log.error("Failed to read sources under {}", config.root(), ex);
      return ExitCode.IO_ERROR;
    } catch (PoolInitException ex) {
      log.error("Worker pool failed to start: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ExitCode exitFor(BatchResult result, Optional<Severity> failOn) {
    if (failOn.isEmpty()) {
      return ExitCode.SUCCESS;
    }
    Severity threshold = failOn.get();
    boolean blocking = result.allIssues().stream().anyMatch(issue -> issue.severity().atLeast(threshold));
    return blocking ? ExitCode.FINDINGS : ExitCode.SUCCESS;
  }

  static List<String> report(BatchResult result) {
    List<String> lines = new ArrayList<>();
    for (FileAnalysisResult file : result.files()) {
      for (Issue issue : file.issues()) {
        lines.add(String.format("%s:%d:%d %s [%s] %s",
            issue.file(), issue.line(), issue.column(), issue.severity(), issue.type(), issue.message()));
      }
    }
    lines.addAll(result.incompleteNotices());
    BatchStatistics stats = result.statistics();
    lines.add(String.format(
        "%d files, %d issues; tasks: %d passed, %d failed, %d timed out, %d crashed, %d rejected (%d ms)",
        result.files().size(), result.allIssues().size(), stats.passed(), stats.failed(), stats.timedOut(),
        stats.crashed(), stats.rejected(), stats.totalDurationMillis()));
    return lines;
  }

  private static void printPlan(EngineConfig config, List<SourceFile> files) {
    PoolSettings pool = config.pool();
    List<String> lines = new ArrayList<>();
    lines.add("Analyze dry-run: no workers will be started.");
    lines.add(" Root              : " + config.root());
    lines.add(" Files             : " + files.size());
    lines.add(" Analyzers         : " + String.join(",", config.analyzers()));
    lines.add(" Tasks             : " + (long) files.size() * config.analyzers().size());
    lines.add(" Workers           : " + pool.maxWorkers());
    lines.add(" Queue capacity    : " + pool.queueCapacity());
    lines.add(" Per-task timeout  : " + pool.perTaskTimeoutMs() + " ms");
    lines.add(" Batch timeout     : " + config.batchTimeoutMs() + " ms");
    lines.add(" Submission        : " + (config.sequential() ? "sequential" : "parallel"));
    lines.add(" Fail on           : " + config.failOn().map(Enum::name).orElse("<none>"));
    lines.add(" Re-run without --dry-run to analyse.");
    CliPrinter.printLines(lines);
  }
}
