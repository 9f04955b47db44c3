package com.fintech.permits.controller;

import com.fintech.permits.dto.ApplicationView;
import com.fintech.permits.dto.QueueHealth;
import com.fintech.permits.dto.QueueMetricsSummary;
import com.fintech.permits.dto.QueuePosition;
import com.fintech.permits.dto.QueueStatusSnapshot;
import com.fintech.permits.entity.QueueMetricsSample;
import com.fintech.permits.scheduler.PermitJobDispatcher;
import com.fintech.permits.service.PermitJobQueue;
import com.fintech.permits.service.QueueMetricsCollector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for the permit generation queue.
 * <p>
 * Provides endpoints for:
 * - Queue status, positions and stuck applications
 * - Enqueueing, requeueing and cancelling jobs
 * - Queue metrics and health
 */
@RestController
@RequestMapping("/api/v1/queue")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Permit Queue", description = "Permit generation queue operations API")
public class QueueController {

    private final PermitJobQueue jobQueue;
    private final PermitJobDispatcher dispatcher;
    private final QueueMetricsCollector metricsCollector;

    @Operation(summary = "Get queue status", description = "Job counts per queue status and worker pool capacity.")
    @ApiResponse(responseCode = "200", description = "Status retrieved successfully",
            content = @Content(schema = @Schema(implementation = QueueStatusSnapshot.class)))
    @GetMapping("/status")
    public ResponseEntity<QueueStatusSnapshot> getStatus() {
        QueueStatusSnapshot snapshot = jobQueue.snapshot();
        snapshot.setLocalActiveWorkers(dispatcher.getActiveWorkers());
        return ResponseEntity.ok(snapshot);
    }

    @Operation(summary = "Get queue position", description = "Position in the queue and estimated wait for an application.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Position retrieved",
                    content = @Content(schema = @Schema(implementation = QueuePosition.class))),
            @ApiResponse(responseCode = "404", description = "Application not found")
    })
    @GetMapping("/applications/{id}/position")
    public ResponseEntity<QueuePosition> getPosition(
            @Parameter(description = "Application ID") @PathVariable Long id) {
        return ResponseEntity.ok(jobQueue.position(id));
    }

    @Operation(
            summary = "Enqueue permit generation",
            description = "Queues a paid application for permit generation. Also requeues a FAILED or CANCELLED job. " +
                    "Idempotent for applications already queued, running or completed."
    )
    @ApiResponse(responseCode = "200", description = "Request handled; 'queued' tells whether this call queued the job")
    @PostMapping("/applications/{id}")
    public ResponseEntity<Map<String, Object>> enqueue(
            @Parameter(description = "Application ID") @PathVariable Long id,
            @Parameter(description = "Priority, higher runs first") @RequestParam(required = false) Integer priority) {
        boolean queued = priority != null ? jobQueue.enqueue(id, priority) : jobQueue.enqueue(id);
        log.info("Enqueue requested via API for application {}: queued={}", id, queued);
        return ResponseEntity.ok(Map.of("applicationId", id, "queued", queued));
    }

    @Operation(summary = "Cancel a queued job", description = "Removes a job from the queue. Running jobs cannot be cancelled.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job cancelled"),
            @ApiResponse(responseCode = "404", description = "Application not found or not queued"),
            @ApiResponse(responseCode = "409", description = "Job already running")
    })
    @DeleteMapping("/applications/{id}")
    public ResponseEntity<Map<String, Object>> cancel(
            @Parameter(description = "Application ID") @PathVariable Long id) {
        if (jobQueue.cancel(id)) {
            return ResponseEntity.ok(Map.of("applicationId", id, "cancelled", true));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("applicationId", id, "cancelled", false));
    }

    @Operation(summary = "Get stuck applications", description = "In-flight applications with no progress past the stuck threshold.")
    @ApiResponse(responseCode = "200", description = "Stuck applications retrieved successfully")
    @GetMapping("/stuck")
    public ResponseEntity<List<ApplicationView>> getStuck() {
        return ResponseEntity.ok(jobQueue.findStuck().stream()
                .map(ApplicationView::from)
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Get queue metrics", description = "Aggregated queue metrics over a window of hours.")
    @ApiResponse(responseCode = "200", description = "Metrics retrieved successfully",
            content = @Content(schema = @Schema(implementation = QueueMetricsSummary.class)))
    @GetMapping("/metrics")
    public ResponseEntity<QueueMetricsSummary> getMetrics(
            @Parameter(description = "Window in hours") @RequestParam(defaultValue = "24") int windowHours) {
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be positive");
        }
        return ResponseEntity.ok(metricsCollector.summarize(Duration.ofHours(windowHours)));
    }

    @Operation(summary = "Record a metrics sample", description = "Records a queue metrics sample now.")
    @ApiResponse(responseCode = "200", description = "Sample recorded")
    @PostMapping("/metrics/sample")
    public ResponseEntity<QueueMetricsSample> sample() {
        return ResponseEntity.ok(metricsCollector.collectSample());
    }

    @Operation(summary = "Queue health", description = "Healthy, degraded or unhealthy verdict from the latest sample.")
    @ApiResponse(responseCode = "200", description = "Health retrieved successfully",
            content = @Content(schema = @Schema(implementation = QueueHealth.class)))
    @GetMapping("/health")
    public ResponseEntity<QueueHealth> health() {
        return ResponseEntity.ok(metricsCollector.health());
    }
}
