/**
 * Filesystem adapters feeding {@link ca.gc.cra.sentinel.application.port.SourceFileProvider}.
 */
package ca.gc.cra.sentinel.infrastructure.source;
