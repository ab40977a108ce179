package com.snipebot.checkout;

/**
 * Structured checkout outcome. {@code ok} with a {@code redirectUrl} is provisional: the buyer still has to
 * approve the payment out of band.
 */
public record CheckoutResult(
        boolean ok,
        String message,
        String code,
        String purchaseId,
        String redirectUrl,
        CheckoutStep step
) {
    static final String NO_PURCHASE_ID = "Checkout build did not return purchase_id";
    static final String NO_PAYMENT_METHOD = "No saved payment method found. Add a card on the marketplace.";
    static final String AWAITING_APPROVAL = "Approve in your banking app. Purchase will complete when done.";
    static final String COMPLETED = "Purchase completed.";

    public static CheckoutResult failed(String code, String message) {
        return new CheckoutResult(false, message, code, null, null, CheckoutStep.FAILED);
    }

    public static CheckoutResult failed(String code, String message, String purchaseId) {
        return new CheckoutResult(false, message, code, purchaseId, null, CheckoutStep.FAILED);
    }

    public static CheckoutResult awaitingApproval(String purchaseId, String redirectUrl) {
        return new CheckoutResult(true, AWAITING_APPROVAL, null, purchaseId, redirectUrl,
                CheckoutStep.AWAITING_EXTERNAL_APPROVAL);
    }

    public static CheckoutResult completed(String purchaseId) {
        return new CheckoutResult(true, COMPLETED, null, purchaseId, null, CheckoutStep.COMPLETED);
    }

    public boolean awaitingApproval() {
        return step == CheckoutStep.AWAITING_EXTERNAL_APPROVAL;
    }
}
