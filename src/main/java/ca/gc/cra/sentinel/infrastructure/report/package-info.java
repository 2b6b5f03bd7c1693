/**
 * Report serializers for completed batches (Jackson streaming JSON).
 */
package ca.gc.cra.sentinel.infrastructure.report;
