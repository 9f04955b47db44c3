package com.fintech.permits.controller;

import com.fintech.permits.dto.RecoveryScanResult;
import com.fintech.permits.dto.RecoveryStats;
import com.fintech.permits.entity.RecoveryAttempt;
import com.fintech.permits.service.PaymentRecoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/recovery")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Recovery", description = "Stuck payment recovery operations")
public class RecoveryController {

    private final PaymentRecoveryService recoveryService;

    @Operation(
            summary = "Trigger a recovery scan",
            description = "Runs a payment recovery scan now. Useful after a gateway outage or a webhook delivery gap."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Scan completed",
                    content = @Content(schema = @Schema(implementation = RecoveryScanResult.class))),
            @ApiResponse(responseCode = "409", description = "Scan already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<RecoveryScanResult> triggerRecovery() {
        log.info("Manual recovery scan triggered via API");
        return ResponseEntity.ok(recoveryService.runRecoveryScan());
    }

    @Operation(summary = "Get recovery statistics", description = "Attempt counts per status and average attempts within a window.")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = RecoveryStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<RecoveryStats> getStats(
            @Parameter(description = "Window in hours") @RequestParam(defaultValue = "24") int windowHours) {
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be positive");
        }
        return ResponseEntity.ok(recoveryService.getStats(windowHours));
    }

    @Operation(
            summary = "Get payments needing manual review",
            description = "Returns recoveries that used every attempt without reaching a final gateway status."
    )
    @ApiResponse(responseCode = "200", description = "Recoveries needing review retrieved successfully")
    @GetMapping("/needs-review")
    public ResponseEntity<List<RecoveryAttempt>> getNeedingReview() {
        return ResponseEntity.ok(recoveryService.getNeedingReview());
    }
}
