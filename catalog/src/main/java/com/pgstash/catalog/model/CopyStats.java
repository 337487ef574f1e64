package com.pgstash.catalog.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timing of a copy run. Durations are in seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CopyStats {
    private double copyTime;
    private int numberOfWorkers;
    @Builder.Default
    private Map<String, Double> jobTimes = new LinkedHashMap<>();
}
