package com.snipebot.bridge;

import java.util.Locale;

/**
 * Error vocabulary returned by the marketplace bridge, grouped by how the pipeline reacts to it.
 */
public enum BridgeErrorCode {
  RATE_LIMITED,
  FORBIDDEN,
  DATADOME_CHALLENGE,
  SESSION_EXPIRED,
  MISSING_COOKIE,
  BRIDGE_UNREACHABLE,
  REQUEST_FAILED,
  HTTP_ERROR,
  PARSE_ERROR,
  UNKNOWN;

  public static BridgeErrorCode of(String code) {
    if (code == null || code.isBlank()) {
      return UNKNOWN;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }

  /**
   * Only throttling is worth retrying on the same identity.
   */
  public boolean isRetryable() {
    return this == RATE_LIMITED;
  }

  /**
   * The proxy that made the request was recognised as a bot and should be penalised.
   */
  public boolean isIdentityDamaging() {
    return this == FORBIDDEN || this == DATADOME_CHALLENGE;
  }

  public boolean isSessionLevel() {
    return this == SESSION_EXPIRED || this == MISSING_COOKIE;
  }

  public boolean isConnectivity() {
    return this == BRIDGE_UNREACHABLE;
  }
}
