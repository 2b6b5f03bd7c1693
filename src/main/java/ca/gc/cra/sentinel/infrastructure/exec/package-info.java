/**
 * Thread and executor factories for the engine coordinator and worker threads.
 */
package ca.gc.cra.sentinel.infrastructure.exec;
