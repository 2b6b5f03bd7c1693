package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.analysis.AnalyzerRegistry;
import ca.gc.cra.sentinel.application.engine.WorkerPool;
import ca.gc.cra.sentinel.application.pipeline.AnalysisOrchestrator;
import ca.gc.cra.sentinel.application.port.EngineEventSink;
import ca.gc.cra.sentinel.application.port.IssuePostProcessor;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.SourceFileProvider;
import ca.gc.cra.sentinel.infrastructure.events.LoggingEngineEventSink;
import ca.gc.cra.sentinel.infrastructure.filter.SnippetPatternIssueFilter;
import ca.gc.cra.sentinel.infrastructure.source.DirectorySourceScanner;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the orchestrator, worker pool and adapters for one {@link EngineConfig}.
 * <p><strong>Thread-safety:</strong> Factory methods build new object graphs and are not
 * synchronized; call them during startup.</p>
 * <p><strong>Lifecycle:</strong> the caller owns the returned orchestrator and must close it; closing it
 * shuts the pool down.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final EngineConfig config;
  private final MetricsPort metrics;
  private final IssuePostProcessor postProcessor;

  /**
   * Creates a composition root that filters known-benign findings when a batch asks for it.
   *
   * @param config effective configuration
   * @param metrics metrics adapter shared by every component
   */
  public CompositionRoot(EngineConfig config, MetricsPort metrics) {
    this(config, metrics, new SnippetPatternIssueFilter());
  }

  /**
   * Creates a composition root.
   *
   * @param config effective configuration
   * @param metrics metrics adapter shared by every component
   * @param postProcessor downstream false-positive reduction
   */
  public CompositionRoot(EngineConfig config, MetricsPort metrics, IssuePostProcessor postProcessor) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
  }

  public EngineConfig config() {
    return config;
  }

  /**
   * Source provider scanning {@link EngineConfig#root()}.
   *
   * @return directory scanner
   * @throws IllegalArgumentException if the root is not a readable directory
   */
  public SourceFileProvider sourceProvider() {
    return new DirectorySourceScanner(config.root(), config.maxFileBytes());
  }

  /**
   * Event sink that logs engine events and counts them under {@code engineEvents.*}.
   *
   * @return new sink
   */
  public EngineEventSink eventSink() {
    return new LoggingEngineEventSink(metrics);
  }

  /**
   * Creates an uninitialized pool running the built-in analyzers.
   *
   * @param events sink receiving the pool's lifecycle events
   * @return new pool; starts its coordinator thread immediately
   */
  public WorkerPool workerPool(EngineEventSink events) {
    return new WorkerPool(config.pool(), AnalyzerRegistry::defaults, metrics, events);
  }

  /**
   * Creates an orchestrator over a fresh pool.
   *
   * @return orchestrator; initialize lazily on first batch
   */
  public AnalysisOrchestrator orchestrator() {
    EngineEventSink events = eventSink();
    return new AnalysisOrchestrator(workerPool(events), config.batchTimeoutMs(), postProcessor, metrics, events);
  }
}
