/**
 * Hexagonal ports used by the engine and pipeline: metrics, engine events, issue post-processing
 * and source file supply.
 * <p><strong>Concurrency:</strong> Implementations must tolerate calls from multiple threads.</p>
 */
package ca.gc.cra.sentinel.application.port;
