package com.fintech.permits.client;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.exception.InvalidWebhookSignatureException;
import com.fintech.permits.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the raw body, hex encoded. Accepts an optional {@code sha256=} prefix.
 */
@Component
@Slf4j
public class HmacWebhookSignatureVerifier implements WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final PipelineProperties properties;

    public HmacWebhookSignatureVerifier(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public void verify(String payload, String signatureHeader) {
        if (!properties.getWebhook().isVerifySignature()) {
            return;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Missing webhook signature");
        }

        String provided = signatureHeader.trim();
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }

        byte[] expected = sign(payload);
        byte[] actual;
        try {
            actual = HexFormat.of().parseHex(provided.toLowerCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidWebhookSignatureException("Malformed webhook signature");
        }

        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("Rejected webhook with invalid signature");
            throw new InvalidWebhookSignatureException("Webhook signature does not match");
        }
    }

    /**
     * Hex signature for a payload. Also used by tests and the gateway simulator.
     */
    public String signatureFor(String payload) {
        return HexFormat.of().formatHex(sign(payload));
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(
                    properties.getWebhook().getSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new PipelineException("HMAC-SHA256 unavailable", e);
        }
    }
}
