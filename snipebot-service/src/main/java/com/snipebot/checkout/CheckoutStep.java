package com.snipebot.checkout;

/**
 * Checkout state machine: {@code INIT -> BUILD_REQUESTED -> DELIVERY_CONFIGURED -> PAYMENT_ATTACHED} and then
 * one of the three terminal states.
 */
public enum CheckoutStep {
    INIT(null),
    BUILD_REQUESTED("Initiating checkout..."),
    DELIVERY_CONFIGURED("Configuring delivery..."),
    PAYMENT_ATTACHED("Adding payment..."),
    AWAITING_EXTERNAL_APPROVAL("3DS required - open in browser"),
    COMPLETED("Purchase completed."),
    FAILED(null);

    private final String progressMessage;

    CheckoutStep(String progressMessage) {
        this.progressMessage = progressMessage;
    }

    public String progressMessage() {
        return progressMessage;
    }
}
