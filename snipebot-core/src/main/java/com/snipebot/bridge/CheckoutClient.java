package com.snipebot.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * Multi-step purchase calls. Every step of one checkout should go through the same proxy.
 * Results complete off the calling thread.
 */
public interface CheckoutClient {

  CompletableFuture<BridgeResult> buildCheckout(long orderId, String proxy);

  CompletableFuture<BridgeResult> putCheckoutComponents(String purchaseId, ObjectNode components, String proxy);

  CompletableFuture<BridgeResult> nearbyPickupPoints(long shippingOrderId, double latitude, double longitude,
                                                     String countryCode, String proxy);
}
