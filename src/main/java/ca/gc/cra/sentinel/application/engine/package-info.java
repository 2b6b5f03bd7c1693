/**
 * Worker pool runtime: bounded task queue, result correlation with per-task deadlines, worker
 * threads with crash isolation and respawn, and graceful or forced shutdown.
 */
package ca.gc.cra.sentinel.application.engine;
