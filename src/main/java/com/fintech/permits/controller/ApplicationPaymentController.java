package com.fintech.permits.controller;

import com.fintech.permits.dto.ApplicationView;
import com.fintech.permits.dto.AttachOrderRequest;
import com.fintech.permits.dto.PaymentStateTokenResponse;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.PaymentStateToken;
import com.fintech.permits.service.ApplicationStateService;
import com.fintech.permits.service.PaymentStateTokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Client-facing payment operations on a permit application.
 */
@RestController
@RequestMapping("/api/v1/applications")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Applications", description = "Permit application payment API")
public class ApplicationPaymentController {

    private final ApplicationStateService stateService;
    private final PaymentStateTokenService tokenService;

    @Operation(summary = "Get application", description = "Returns the payment and permit state of an application.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Application found",
                    content = @Content(schema = @Schema(implementation = ApplicationView.class))),
            @ApiResponse(responseCode = "404", description = "Application not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<ApplicationView> getApplication(
            @Parameter(description = "Application ID") @PathVariable Long id) {
        return ResponseEntity.ok(ApplicationView.from(stateService.getApplication(id)));
    }

    @Operation(summary = "Get payment events", description = "Returns the payment event ledger of an application, oldest first.")
    @ApiResponse(responseCode = "200", description = "Events retrieved successfully")
    @GetMapping("/{id}/events")
    public ResponseEntity<List<PaymentEvent>> getEvents(
            @Parameter(description = "Application ID") @PathVariable Long id) {
        stateService.getApplication(id);
        return ResponseEntity.ok(stateService.getEvents(id));
    }

    @Operation(
            summary = "Issue a payment state token",
            description = "Issues the single-use token the client must present when attaching a payment order."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token issued"),
            @ApiResponse(responseCode = "404", description = "Application not found"),
            @ApiResponse(responseCode = "409", description = "Payment already started")
    })
    @PostMapping("/{id}/payment-token")
    public ResponseEntity<PaymentStateTokenResponse> issueToken(
            @Parameter(description = "Application ID") @PathVariable Long id) {
        PaymentStateToken token = tokenService.issue(id);
        return ResponseEntity.ok(PaymentStateTokenResponse.builder()
                .applicationId(id)
                .token(token.getToken())
                .expiresAt(token.getExpiresAt())
                .build());
    }

    @Operation(
            summary = "Attach a payment order",
            description = "Binds the gateway payment order to the application (INITIATED to PENDING_PAYMENT)."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order attached",
                    content = @Content(schema = @Schema(implementation = ApplicationView.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "403", description = "Invalid, expired or used payment state token"),
            @ApiResponse(responseCode = "409", description = "Order already attached or application not payable")
    })
    @PostMapping("/{id}/payment-order")
    public ResponseEntity<ApplicationView> attachOrder(
            @Parameter(description = "Application ID") @PathVariable Long id,
            @Valid @RequestBody AttachOrderRequest request) {
        log.info("Attaching payment order {} to application {}", request.getOrderId(), id);
        return ResponseEntity.ok(ApplicationView.from(stateService.attachOrder(id, request.getOrderId(),
                request.getPaymentIntentId(), request.getAmount(), request.getCurrency(), request.getStateToken())));
    }
}
