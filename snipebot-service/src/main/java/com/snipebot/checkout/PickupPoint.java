package com.snipebot.checkout;

public record PickupPoint(String rateUuid, String pointCode, String pointUuid, double latitude, double longitude) {
}
