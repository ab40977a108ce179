package com.snipebot.sniper;

import com.snipebot.config.SnipebotProperties;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime switches for autobuy and simulation, seeded from configuration and flipped from the status API.
 */
public class SniperToggles {

    private final AtomicBoolean autobuyEnabled;
    private final AtomicBoolean simulationMode;

    public SniperToggles(boolean autobuyEnabled, boolean simulationMode) {
        this.autobuyEnabled = new AtomicBoolean(autobuyEnabled);
        this.simulationMode = new AtomicBoolean(simulationMode);
    }

    public static SniperToggles from(SnipebotProperties.Sniper sniper) {
        return new SniperToggles(sniper.autobuyEnabled(), sniper.simulationMode());
    }

    public boolean autobuyEnabled() {
        return autobuyEnabled.get();
    }

    public boolean simulationMode() {
        return simulationMode.get();
    }

    public void setAutobuyEnabled(boolean enabled) {
        autobuyEnabled.set(enabled);
    }

    public void setSimulationMode(boolean enabled) {
        simulationMode.set(enabled);
    }
}
