package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TrainingResult {

    public enum Source { LOADED, TRAINED }

    Source source;
    int sampleCount;
    Double trainingScore;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant trainedAt;
    String modelPath;
}
