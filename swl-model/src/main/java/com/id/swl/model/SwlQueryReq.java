package com.id.swl.model;

import com.id.swl.model.enums.SwlSeries;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwlQueryReq {

    private String source;
    private String parameter;
    private Instant start;
    private Instant end;
    @Builder.Default
    private SwlSeries series = SwlSeries.RAW;

}
