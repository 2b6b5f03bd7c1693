/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize source excerpts before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Masking helpers keep detected secrets out of findings and logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.logging;
