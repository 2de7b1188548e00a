package com.id.swl.modules.storage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One stored point of either the raw or the min1 collection. Unique on
 * (source, parameter, tsMicros).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MeasurementEntity {

    public static final String ID = "id";
    public static final String SOURCE = "source";
    public static final String PARAMETER = "parameter";
    public static final String TS_MICROS = "tsMicros";
    public static final String VALUE = "value";
    public static final String QUALITY = "quality";
    public static final String KEY_IDX = "source_parameter_tsMicros_idx";

    @Id
    @Field("_id")
    private String id;

    private String source;
    private String parameter;

    // Epoch microseconds, the precision kept for timestamps
    private Long tsMicros;

    private Double value;
    private Integer quality;

    public static long toMicros(Instant t) {
        return Math.addExact(Math.multiplyExact(t.getEpochSecond(), 1_000_000L), t.getNano() / 1_000);
    }

    public static Instant toInstant(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }
}
