/**
 * Metrics adapters for the {@link ca.gc.cra.sentinel.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; the pool coordinator, workers and
 * orchestrator callers record concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code engine.*} and {@code pipeline.*}.</p>
 * <p><strong>Security:</strong> Only counters and timings are exported; file content never is.</p>
 */
package ca.gc.cra.sentinel.infrastructure.metrics;
