package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class TrainingStatusResponse {
    ForecasterState state;
    boolean trained;
    boolean modelExists;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastTrained;
    int sampleCount;
    Map<String, Long> unknownCategories;
}
