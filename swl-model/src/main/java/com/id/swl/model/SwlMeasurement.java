package com.id.swl.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwlMeasurement {

    private Instant time;
    private String source;
    private String parameter;
    private Double value;
    private Integer quality;

}
