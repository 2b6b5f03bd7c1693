/**
 * Source files supplied to the analysis pipeline.
 */
package ca.gc.cra.sentinel.domain.source;
