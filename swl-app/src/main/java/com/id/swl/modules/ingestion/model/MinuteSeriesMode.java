package com.id.swl.modules.ingestion.model;

/**
 * How the min1 write set of a batch was produced.
 */
public enum MinuteSeriesMode {
    EMPTY_BATCH,
    PASS_THROUGH,
    RESAMPLED,
    INSUFFICIENT_SAMPLES
}
