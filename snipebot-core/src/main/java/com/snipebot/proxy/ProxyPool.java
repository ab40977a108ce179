package com.snipebot.proxy;

public enum ProxyPool {
  /**
   * Datacenter/ISP proxies used for high-frequency feed polling. Subject to strike escalation.
   */
  SCRAPING,
  /**
   * Residential proxies reserved for checkout. Always treated as active.
   */
  CHECKOUT
}
