package com.phillippitts.sendspin.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pacing parameters of the playback loop. Defaults match what controllers expect from a
 * player; change them only when tuning for an unusual output device.
 */
@Validated
@ConfigurationProperties(prefix = "sendspin.playback")
public class PlaybackProperties {

    /** Device buffer size as a multiple of the device's minimum buffer. */
    @Min(1)
    @Max(32)
    private int bufferSizeFactor = 6;

    /** Device buffer length used when the line reports no minimum, in milliseconds. */
    @Min(10)
    private int fallbackMinBufferMillis = 100;

    /** Upper bound on the pre-buffer wait before starting the device. */
    @Min(0)
    private long prebufferTimeoutMs = 5_000;

    /** Chunks whose play time is further in the past are discarded before the loop starts. */
    @Min(0)
    private long fastForwardThresholdMs = 500;

    /** Chunks due later than this are held back by sleeping. */
    @Min(1)
    private long earlyThresholdMs = 100;

    /** Longest single sleep while waiting for an early chunk. */
    @Min(10)
    private long maxSleepMs = 500;

    /** Time subtracted from each sleep to wake up ahead of the deadline. */
    @Min(0)
    private long sleepMarginMs = 10;

    /** Chunks later than this are dropped instead of written. */
    @Min(1)
    private long lateDropThresholdMs = 1_000;

    /** Wait for the next chunk when the buffer is empty. */
    @Min(1)
    private long pollIntervalMs = 5;

    public int getBufferSizeFactor() {
        return bufferSizeFactor;
    }

    public void setBufferSizeFactor(int bufferSizeFactor) {
        this.bufferSizeFactor = bufferSizeFactor;
    }

    public int getFallbackMinBufferMillis() {
        return fallbackMinBufferMillis;
    }

    public void setFallbackMinBufferMillis(int fallbackMinBufferMillis) {
        this.fallbackMinBufferMillis = fallbackMinBufferMillis;
    }

    public long getPrebufferTimeoutMs() {
        return prebufferTimeoutMs;
    }

    public void setPrebufferTimeoutMs(long prebufferTimeoutMs) {
        this.prebufferTimeoutMs = prebufferTimeoutMs;
    }

    public long getFastForwardThresholdMs() {
        return fastForwardThresholdMs;
    }

    public void setFastForwardThresholdMs(long fastForwardThresholdMs) {
        this.fastForwardThresholdMs = fastForwardThresholdMs;
    }

    public long getEarlyThresholdMs() {
        return earlyThresholdMs;
    }

    public void setEarlyThresholdMs(long earlyThresholdMs) {
        this.earlyThresholdMs = earlyThresholdMs;
    }

    public long getMaxSleepMs() {
        return maxSleepMs;
    }

    public void setMaxSleepMs(long maxSleepMs) {
        this.maxSleepMs = maxSleepMs;
    }

    public long getSleepMarginMs() {
        return sleepMarginMs;
    }

    public void setSleepMarginMs(long sleepMarginMs) {
        this.sleepMarginMs = sleepMarginMs;
    }

    public long getLateDropThresholdMs() {
        return lateDropThresholdMs;
    }

    public void setLateDropThresholdMs(long lateDropThresholdMs) {
        this.lateDropThresholdMs = lateDropThresholdMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }
}
