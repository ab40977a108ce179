package com.snipebot.proxy;

import java.util.List;

public record PoolStatusSnapshot(
    ProxyPool pool,
    List<ProxyView> active,
    List<ProxyView> cooldown,
    List<ProxyView> blocked,
    int total
) {
}
