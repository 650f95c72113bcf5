package com.bloodforecast.service;

import com.bloodforecast.dto.AsyncJobResponse;
import com.bloodforecast.dto.AsyncJobStatus;
import com.bloodforecast.dto.ForecastJobType;
import com.bloodforecast.exception.BloodForecastException;
import com.bloodforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * In-memory registry of background forecasting jobs executed on a fixed pool.
 * Finished jobs are evicted oldest first once more than {@code jobs.max-retained}
 * are held.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobService {

    private final Clock clock;

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(ForecastJobType jobType, String requestId, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, jobType, requestId, clock.instant());
        jobs.put(jobId, state);
        evictIfNeeded();

        log.info("Job queued | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        CompletableFuture.runAsync(() -> execute(state, task), executor);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Supplier<Object> task) {
        state.markRunning(clock.instant());
        try {
            Object result = task.get();
            state.markCompleted(clock.instant(), result);
            log.info("Job completed | jobId={} | type={} | items={}", state.jobId, state.jobType, itemCount(result));
        } catch (BloodForecastException ex) {
            state.markFailed(clock.instant(), ex.getErrorCode(), ex.getMessage());
            log.warn("Job failed | jobId={} | type={} | errorCode={} | reason={}",
                     state.jobId, state.jobType, ex.getErrorCode(), ex.getMessage());
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            state.markFailed(clock.instant(), "INTERNAL_ERROR", message);
            log.error("Job failed | jobId={} | type={} | reason={}", state.jobId, state.jobType, message, ex);
        }
    }

    private static Integer itemCount(Object result) {
        return result instanceof Collection ? ((Collection<?>) result).size() : null;
    }

    private void evictIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final ForecastJobType jobType;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status;
        private volatile String errorCode;
        private volatile String message;
        private volatile Object result;

        private JobState(UUID jobId, ForecastJobType jobType, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
            this.status = AsyncJobStatus.QUEUED;
            this.message = "Queued";
        }

        private synchronized void markRunning(Instant now) {
            this.startedAt = now;
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Job started";
        }

        private synchronized void markCompleted(Instant now, Object result) {
            this.completedAt = now;
            this.result = result;
            this.message = "Job completed";
            this.status = AsyncJobStatus.COMPLETED;
        }

        private synchronized void markFailed(Instant now, String errorCode, String message) {
            this.completedAt = now;
            this.errorCode = errorCode;
            this.message = message;
            this.status = AsyncJobStatus.FAILED;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .requestId(requestId)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(startedAt != null && completedAt != null
                    ? Duration.between(startedAt, completedAt).toMillis() : null)
                .errorCode(errorCode)
                .message(message)
                .resultType(result != null ? result.getClass().getSimpleName() : null)
                .itemCount(itemCount(result))
                .result(result)
                .build();
        }
    }
}
