package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Controls the startup sweep that fails runs left in {@code running} by a
 * process that died mid-run.
 */
public class ReconciliationConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("stale-after-hours")
    private int staleAfterHours = 24;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getStaleAfterHours() {
        return staleAfterHours;
    }

    public void setStaleAfterHours(int staleAfterHours) {
        this.staleAfterHours = staleAfterHours;
    }

    public Duration staleAfter() {
        return Duration.ofHours(staleAfterHours);
    }
}
