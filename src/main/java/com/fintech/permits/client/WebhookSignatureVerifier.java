package com.fintech.permits.client;

import com.fintech.permits.exception.InvalidWebhookSignatureException;

/**
 * Authenticates an inbound gateway webhook before any state is touched.
 */
public interface WebhookSignatureVerifier {

    /**
     * @param payload         raw request body exactly as received
     * @param signatureHeader value of the signature header, may be null
     * @throws InvalidWebhookSignatureException if the signature is missing or does not match
     */
    void verify(String payload, String signatureHeader);
}
