package com.id.swl.client.modules.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"rows", "raw", "min1", "elapsed_s"})
public record BulkLoadResult(long rows,
                             long raw,
                             long min1,
                             @JsonProperty("elapsed_s") long elapsedS) {
}
