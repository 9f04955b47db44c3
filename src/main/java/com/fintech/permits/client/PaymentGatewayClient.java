package com.fintech.permits.client;

import com.fintech.permits.dto.GatewayPaymentStatus;
import com.fintech.permits.exception.GatewayException;

/**
 * Interface for querying the external payment gateway.
 * <p>
 * In production, implementations would call the gateway's payment intent API
 * (Stripe, Conekta, etc.). The mock implementation simulates gateway behavior for testing.
 */
public interface PaymentGatewayClient {

    /**
     * Fetches the current status of a payment intent.
     *
     * @param paymentIntentId the gateway's identifier of the payment intent
     * @return the gateway's view of the payment
     * @throws GatewayException if the gateway is unavailable or rejects the request
     */
    GatewayPaymentStatus getPaymentStatus(String paymentIntentId) throws GatewayException;

    /**
     * Returns the name of this gateway. Used for logging and metrics.
     */
    String getGatewayName();

    boolean isAvailable();
}
