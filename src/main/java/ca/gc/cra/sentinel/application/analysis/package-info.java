/**
 * Built-in analyzers executed inside workers: line-oriented regex rule tables for security, quality,
 * bug, performance and secret checks, resolved through the closed {@link
 * ca.gc.cra.sentinel.application.analysis.AnalyzerId} set.
 * <p><strong>Concurrency:</strong> Rule tables are immutable; each worker owns its registry.</p>
 * <p><strong>Security:</strong> Secret findings mask the matched value in their snippet.</p>
 */
package ca.gc.cra.sentinel.application.analysis;
