package com.snipebot.session;

import com.snipebot.bridge.SessionCredentials;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current session cookie; seeded from configuration and replaced when the user reconnects.
 */
public class CookieSessionCredentials implements SessionCredentials {

    private final AtomicReference<String> cookie = new AtomicReference<>();

    public CookieSessionCredentials(String initialCookie) {
        update(initialCookie);
    }

    @Override
    public Optional<String> cookie() {
        return Optional.ofNullable(cookie.get());
    }

    public void update(String value) {
        cookie.set(value == null || value.isBlank() ? null : value.trim());
    }
}
