package com.id.swl.modules.ingestion.model;

import com.id.swl.model.SwlIngestRes;

public record IngestionResult(
        int storedRaw,
        int storedMin1,
        MinuteSeriesMode mode
) {

    public static IngestionResult empty() {
        return new IngestionResult(0, 0, MinuteSeriesMode.EMPTY_BATCH);
    }

    public SwlIngestRes toResponse() {
        return SwlIngestRes.builder()
                .storedRaw(storedRaw)
                .storedMin1(storedMin1)
                .build();
    }
}
