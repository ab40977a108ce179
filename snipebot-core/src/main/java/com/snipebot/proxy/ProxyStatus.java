package com.snipebot.proxy;

public enum ProxyStatus {
  ACTIVE,
  COOLDOWN,
  BLOCKED
}
