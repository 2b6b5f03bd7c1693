/**
 * Command-line entry points.
 * <p>{@link ca.gc.cra.sentinel.api.Main} dispatches to {@code analyze}; commands return an
 * {@link ca.gc.cra.sentinel.api.ExitCode} so tests can run them without exiting the JVM. Reports go to
 * stdout through {@link ca.gc.cra.sentinel.api.CliPrinter}; diagnostics go to the log.</p>
 */
package ca.gc.cra.sentinel.api;
