package com.snipebot.proxy;

import java.net.URI;

/**
 * Helpers for proxy connection URLs ({@code scheme://[user:pass@]host:port}).
 */
public final class ProxyUrls {

  private ProxyUrls() {
  }

  /**
   * The URL with any password replaced by {@code ***}, safe to log or show.
   */
  public static String mask(String proxyUrl) {
    if (proxyUrl == null) {
      return null;
    }
    try {
      URI uri = URI.create(proxyUrl);
      String userInfo = uri.getRawUserInfo();
      if (userInfo == null || userInfo.isEmpty()) {
        return proxyUrl;
      }
      int colon = userInfo.indexOf(':');
      if (colon < 0) {
        return proxyUrl;
      }
      return proxyUrl.replace(userInfo + "@", userInfo.substring(0, colon) + ":***@");
    } catch (IllegalArgumentException e) {
      int at = proxyUrl.lastIndexOf('@');
      return at < 0 ? proxyUrl : "***" + proxyUrl.substring(at);
    }
  }
}
