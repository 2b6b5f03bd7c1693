/**
 * Analysis task primitives exchanged between the orchestrator, the worker pool and workers.
 * <p><strong>Role:</strong> Domain layer; no dependencies on engine or infrastructure types.</p>
 * <p><strong>Concurrency:</strong> Records are immutable and cross thread boundaries by reference.</p>
 * <p><strong>Security:</strong> Payloads carry full file content; log only paths and ids.</p>
 */
package ca.gc.cra.sentinel.domain.task;
