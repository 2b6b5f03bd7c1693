/**
 * Worker message protocol: inbound commands, outbound replies and lifecycle states.
 * <p><strong>Concurrency:</strong> Messages are immutable; workers and coordinator share nothing else.</p>
 */
package ca.gc.cra.sentinel.domain.worker;
