package com.snipebot.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Envelope returned by every bridge call: {@code {ok:true, data}} or {@code {ok:false, code, message}}.
 * Upstream failures travel as values; callers branch on {@link #errorCode()}.
 */
public record BridgeResult(boolean ok, JsonNode data, String code, String message) {

  public BridgeResult {
    data = data == null ? MissingNode.getInstance() : data;
  }

  public static BridgeResult success(JsonNode data) {
    return new BridgeResult(true, data, null, null);
  }

  public static BridgeResult failure(String code, String message) {
    return new BridgeResult(false, null, code, message);
  }

  public static BridgeResult failure(BridgeErrorCode code, String message) {
    return failure(code.name(), message);
  }

  public BridgeErrorCode errorCode() {
    return ok ? null : BridgeErrorCode.of(code);
  }

  public boolean is(BridgeErrorCode expected) {
    return !ok && errorCode() == expected;
  }

  /**
   * Message suitable for logs and the countdown result: the bridge message, else the code.
   */
  public String describe() {
    if (ok) {
      return "ok";
    }
    if (message != null && !message.isBlank()) {
      return message;
    }
    return code == null ? "Unknown error" : code;
  }
}
