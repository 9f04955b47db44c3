package com.fintech.permits.controller;

import com.fintech.permits.dto.ReminderScanResult;
import com.fintech.permits.dto.ReminderStats;
import com.fintech.permits.entity.ReminderRecord;
import com.fintech.permits.service.ReminderScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reminders")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reminders", description = "Voucher and permit expiry reminders")
public class ReminderController {

    private final ReminderScanService reminderScanService;

    @Operation(summary = "Trigger a reminder scan", description = "Runs the voucher and permit expiry scans now.")
    @ApiResponse(responseCode = "200", description = "Scan completed")
    @PostMapping("/run")
    public ResponseEntity<ReminderScanResult> triggerScan() {
        log.info("Manual reminder scan triggered via API");
        return ResponseEntity.ok(reminderScanService.runAll());
    }

    @Operation(summary = "Get reminder statistics", description = "Reminders sent per type within a window.")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully")
    @GetMapping("/stats")
    public ResponseEntity<ReminderStats> getStats(
            @Parameter(description = "Window in days") @RequestParam(defaultValue = "7") int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive");
        }
        return ResponseEntity.ok(reminderScanService.getStats(windowDays));
    }

    @Operation(summary = "Get reminder history", description = "Reminders sent for an application, newest first.")
    @ApiResponse(responseCode = "200", description = "History retrieved successfully")
    @GetMapping("/applications/{applicationId}")
    public ResponseEntity<List<ReminderRecord>> getHistory(
            @Parameter(description = "Application ID") @PathVariable Long applicationId) {
        return ResponseEntity.ok(reminderScanService.getHistory(applicationId));
    }
}
