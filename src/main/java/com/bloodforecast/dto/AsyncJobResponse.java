package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a background forecasting job. {@code itemCount} is the number of
 * forecasts or alerts produced when the job returns a collection.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncJobResponse {
    UUID jobId;
    ForecastJobType jobType;
    AsyncJobStatus status;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    Long durationMs;
    String errorCode;
    String message;
    String resultType;
    Integer itemCount;
    Object result;
}
