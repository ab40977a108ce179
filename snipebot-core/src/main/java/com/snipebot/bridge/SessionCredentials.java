package com.snipebot.bridge;

import java.util.Optional;

/**
 * Provides the marketplace session cookie forwarded with every bridge call.
 */
public interface SessionCredentials {

  Optional<String> cookie();

  static SessionCredentials fixed(String cookie) {
    Optional<String> value = cookie == null || cookie.isBlank() ? Optional.empty() : Optional.of(cookie.trim());
    return () -> value;
  }
}
