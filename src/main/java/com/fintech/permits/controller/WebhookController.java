package com.fintech.permits.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.permits.client.WebhookSignatureVerifier;
import com.fintech.permits.dto.GatewayWebhookEvent;
import com.fintech.permits.dto.WebhookResult;
import com.fintech.permits.service.WebhookIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound payment gateway webhooks.
 * <p>
 * The body is taken raw so the signature is checked over the exact bytes the gateway signed.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Payment gateway webhook receiver")
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Gateway-Signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookIngestionService ingestionService;
    private final ObjectMapper objectMapper;

    @Operation(
            summary = "Receive a payment gateway event",
            description = "Verifies the HMAC signature, deduplicates by event id and applies the event to the " +
                    "application's payment state. Duplicates, unknown orders and unhandled event types are " +
                    "acknowledged with 200 so the gateway stops redelivering."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event accepted (processed, duplicate or ignored)"),
            @ApiResponse(responseCode = "400", description = "Malformed event"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature"),
            @ApiResponse(responseCode = "500", description = "Processing failed; the gateway should redeliver")
    })
    @PostMapping("/payments")
    public ResponseEntity<Map<String, Object>> receivePaymentEvent(
            @Parameter(description = "HMAC-SHA256 of the raw body, hex encoded")
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String payload) {

        signatureVerifier.verify(payload, signature);

        GatewayWebhookEvent event = parse(payload);
        WebhookResult result = ingestionService.handle(event);
        log.debug("Webhook {} ({}) handled: {}", event.getId(), event.getType(), result);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventId", event.getId());
        body.put("result", result);
        return ResponseEntity.ok(body);
    }

    private GatewayWebhookEvent parse(String payload) {
        try {
            return objectMapper.readValue(payload, GatewayWebhookEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed webhook payload: " + e.getOriginalMessage());
        }
    }
}
