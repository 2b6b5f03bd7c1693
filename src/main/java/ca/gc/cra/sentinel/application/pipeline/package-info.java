/**
 * Batch orchestration on top of the worker pool. Fans one task out per file and analyzer, then folds
 * the outcomes into per-file results and batch statistics.
 */
package ca.gc.cra.sentinel.application.pipeline;
