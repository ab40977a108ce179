package com.snipebot.checkout;

import lombok.extern.slf4j.Slf4j;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import java.util.function.Supplier;

/**
 * Opens approval URLs in the system browser; on a headless host the URL is only logged.
 */
@Slf4j
public class DesktopApprovalOpener implements ApprovalOpener {

    private final Supplier<Desktop> desktop;

    public DesktopApprovalOpener() {
        this(DesktopApprovalOpener::systemDesktop);
    }

    /**
     * @param desktop yields the desktop to browse with, or {@code null} when there is none
     */
    DesktopApprovalOpener(Supplier<Desktop> desktop) {
        this.desktop = desktop;
    }

    @Override
    public void open(String url) {
        Desktop target = desktop.get();
        if (target == null || !target.isSupported(Desktop.Action.BROWSE)) {
            log.info("payment approval required, open manually: {}", url);
            return;
        }
        try {
            target.browse(URI.create(url));
            log.info("payment approval opened in browser: {}", url);
        } catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
            log.warn("could not open approval url in browser, open manually: {} ({})", url, e.toString());
        }
    }

    private static Desktop systemDesktop() {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()) {
            return null;
        }
        return Desktop.getDesktop();
    }
}
