/**
 * Engine lifecycle events published to {@code EngineEventSink} adapters.
 * <p><strong>Metrics:</strong> Logging sinks mirror each event as a {@code <prefix>.<key>} counter.</p>
 */
package ca.gc.cra.sentinel.domain.events;
