/**
 * Findings and severities produced by analyzers.
 */
package ca.gc.cra.sentinel.domain.issue;
