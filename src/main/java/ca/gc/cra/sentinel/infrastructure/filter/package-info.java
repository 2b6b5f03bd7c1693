/**
 * Issue post-processing adapters.
 */
package ca.gc.cra.sentinel.infrastructure.filter;
