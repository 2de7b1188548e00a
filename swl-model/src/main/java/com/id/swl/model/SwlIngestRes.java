package com.id.swl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwlIngestRes {

    @JsonProperty("stored_raw")
    private int storedRaw;

    @JsonProperty("stored_min1")
    private int storedMin1;

}
