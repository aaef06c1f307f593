package com.phillippitts.sendspin.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Cadence of client/time requests: a short burst after the handshake, then a periodic re-sync.
 */
@Validated
@ConfigurationProperties(prefix = "sendspin.clock-sync")
public class ClockSyncProperties {

    /** Requests sent right after server/hello. */
    @Min(1)
    private int burstCount = 5;

    /** Gap between burst requests in milliseconds. */
    @Min(1)
    private long burstIntervalMs = 50;

    /** Period of the steady re-sync in milliseconds. */
    @Min(100)
    private long resyncIntervalMs = 30_000;

    public int getBurstCount() {
        return burstCount;
    }

    public void setBurstCount(int burstCount) {
        this.burstCount = burstCount;
    }

    public long getBurstIntervalMs() {
        return burstIntervalMs;
    }

    public void setBurstIntervalMs(long burstIntervalMs) {
        this.burstIntervalMs = burstIntervalMs;
    }

    public long getResyncIntervalMs() {
        return resyncIntervalMs;
    }

    public void setResyncIntervalMs(long resyncIntervalMs) {
        this.resyncIntervalMs = resyncIntervalMs;
    }
}
