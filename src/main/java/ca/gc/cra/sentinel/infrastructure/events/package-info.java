/**
 * {@link ca.gc.cra.sentinel.application.port.EngineEventSink} adapters: structured logging and a
 * bounded in-memory history.
 */
package ca.gc.cra.sentinel.infrastructure.events;
