package com.phillippitts.sendspin.service.metrics;

import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the receive and playback paths.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Chunks dropped on buffer overflow</li>
 *   <li>Chunks dropped as late or skipped by the initial fast-forward</li>
 *   <li>Device write failures</li>
 *   <li>Clock sync round-trip times</li>
 *   <li>Ring buffer fill level</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PlaybackMetrics {

    private static final String METRIC_PREFIX = "sendspin";

    private final MeterRegistry registry;
    private final Counter bufferOverflow;
    private final Counter lateDrops;
    private final Counter fastForwardDrops;
    private final Counter writeErrors;
    private final Counter streamsStarted;
    private final Timer clockRtt;

    public PlaybackMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.bufferOverflow = Counter.builder(METRIC_PREFIX + ".buffer.overflow")
                .description("Audio chunks rejected because the ring buffer was full")
                .register(registry);
        this.lateDrops = Counter.builder(METRIC_PREFIX + ".playback.late.drops")
                .description("Audio chunks dropped because their play time had passed")
                .register(registry);
        this.fastForwardDrops = Counter.builder(METRIC_PREFIX + ".playback.fastforward.drops")
                .description("Stale chunks skipped before playback started")
                .register(registry);
        this.writeErrors = Counter.builder(METRIC_PREFIX + ".playback.write.errors")
                .description("Failed writes to the output device")
                .register(registry);
        this.streamsStarted = Counter.builder(METRIC_PREFIX + ".streams.started")
                .description("Streams announced by the controller")
                .register(registry);
        this.clockRtt = Timer.builder(METRIC_PREFIX + ".clock.rtt")
                .description("Round-trip time of clock sync requests")
                .register(registry);
    }

    /** Exposes the ring buffer fill level as {@code sendspin.buffer.usage} (percent). */
    public void bindBuffer(AudioChunkBuffer buffer) {
        Gauge.builder(METRIC_PREFIX + ".buffer.usage", buffer, AudioChunkBuffer::usagePercent)
                .description("Ring buffer fill level in percent")
                .baseUnit("percent")
                .register(registry);
    }

    public void incrementBufferOverflow() {
        bufferOverflow.increment();
    }

    public void incrementLateDrop() {
        lateDrops.increment();
    }

    public void incrementFastForwardDrops(int count) {
        fastForwardDrops.increment(count);
    }

    public void incrementWriteError() {
        writeErrors.increment();
    }

    public void incrementStreamsStarted() {
        streamsStarted.increment();
    }

    /**
     * Records one clock sync round trip.
     *
     * @param rttMicros round-trip time in microseconds; negative values are ignored
     */
    public void recordClockRtt(long rttMicros) {
        if (rttMicros >= 0) {
            clockRtt.record(rttMicros, TimeUnit.MICROSECONDS);
        }
    }
}
