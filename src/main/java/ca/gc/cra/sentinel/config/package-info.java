/**
 * Configuration records, YAML loading and the composition root for the {@code analyze} mode.
 * <p>Precedence is CLI {@code key=value} over YAML over embedded defaults; values are validated once in
 * {@link ca.gc.cra.sentinel.config.EngineConfig#fromMap}.</p>
 */
package ca.gc.cra.sentinel.config;
