package com.purchasingpower.compliancekb.model.sync;

/**
 * Outcome of indexing one page of source records.
 *
 * @param processed records handled, successfully or not
 * @param errors    chunk writes and record bookkeeping steps that failed
 * @param chunks    chunks written
 */
public record PageIndexResult(int processed, int errors, int chunks) {
}
