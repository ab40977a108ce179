package com.snipebot.bridge;

public record BridgeHealth(boolean ok, String service) {
}
