package com.snipebot.checkout;

public record PaymentMethod(String cardId, String payInMethodId) {
}
