package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.config.properties.PlaybackProperties;
import com.phillippitts.sendspin.domain.AudioChunk;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.exception.AudioDeviceException;
import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import com.phillippitts.sendspin.service.clock.ClockSynchronizer;
import com.phillippitts.sendspin.service.metrics.PlaybackMetrics;
import com.phillippitts.sendspin.service.protocol.SendspinProtocol;
import com.phillippitts.sendspin.service.session.PlayerStateHolder;
import com.phillippitts.sendspin.util.ShutdownTimeouts;
import com.phillippitts.sendspin.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Plays buffered chunks on the output device at the time the controller scheduled them.
 *
 * <p>Each stream gets a dedicated daemon thread that:
 * <ol>
 *   <li>waits until one device buffer worth of audio is queued (bounded by a timeout),</li>
 *   <li>starts the device and, if the clock is synchronized, skips chunks that are already
 *       too old to be worth playing,</li>
 *   <li>writes each chunk when it is due: early chunks are held back by sleeping, very late
 *       chunks are dropped.</li>
 * </ol>
 *
 * <p>Before the clock is synchronized chunks are written as they arrive. Buffer usage is
 * published to the player state as chunks are taken off the buffer.
 *
 * <p>Device failures are fatal only to the stream attempt: the engine logs, publishes an
 * {@link AudioDeviceErrorEvent} and stays idle until the next {@link #start(StreamConfig)}.
 *
 * @since 1.0
 */
@Service
public class PlaybackEngine {

    private static final Logger LOG = LogManager.getLogger(PlaybackEngine.class);

    private static final Set<Integer> SUPPORTED_CHANNELS = Set.of(1, 2);
    private static final Set<Integer> SUPPORTED_BIT_DEPTHS = Set.of(16, 24, 32);
    private static final int LATE_LOG_EVERY = 50;
    private static final int WRITE_ERROR_LOG_EVERY = 50;
    private static final long SYNC_LOG_INTERVAL_MS = 5_000;

    private final AudioChunkBuffer buffer;
    private final ClockSynchronizer clock;
    private final AudioOutputFactory outputFactory;
    private final PlaybackProperties props;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;
    private final PlayerStateHolder stateHolder;

    private final Object lock = new Object();
    private Playback current;
    private volatile float volume = 1.0f;

    public PlaybackEngine(AudioChunkBuffer buffer,
                          ClockSynchronizer clock,
                          AudioOutputFactory outputFactory,
                          PlaybackProperties props,
                          ApplicationEventPublisher publisher,
                          PlaybackMetrics metrics,
                          PlayerStateHolder stateHolder) {
        this.buffer = Objects.requireNonNull(buffer);
        this.clock = Objects.requireNonNull(clock);
        this.outputFactory = Objects.requireNonNull(outputFactory);
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.stateHolder = Objects.requireNonNull(stateHolder);
    }

    /**
     * Stops any current playback and starts playing {@code config}.
     *
     * @return {@code false} if the device could not be opened; the engine is then idle
     */
    public boolean start(StreamConfig config) {
        stop();
        AudioOutput output;
        try {
            validate(config);
            int bufferSize = outputFactory.minBufferSize(config) * props.getBufferSizeFactor();
            output = outputFactory.open(config, bufferSize);
        } catch (AudioDeviceException e) {
            LOG.error("Cannot start playback for {}: {}", config, e.getMessage(), e);
            publisher.publishEvent(new AudioDeviceErrorEvent(e.getReason(), config, Instant.now()));
            return false;
        }
        output.setVolume(volume);

        synchronized (lock) {
            Playback p = new Playback(config, output);
            Thread t = new Thread(() -> run(p), "sendspin-playback");
            t.setDaemon(true);
            p.thread = t;
            current = p;
            t.start();
        }
        LOG.info("Playback started: {} (device buffer {} bytes, latency {} ms)", config,
                output.bufferSizeBytes(), TimeUtils.microsToMillis(output.latencyMicros()));
        return true;
    }

    /** Stops the playback thread and releases the device. Safe to call when idle. */
    public void stop() {
        stop(ShutdownTimeouts.PLAYBACK_THREAD_STOP_TIMEOUT);
    }

    @PreDestroy
    public void shutdown() {
        stop(ShutdownTimeouts.PLAYBACK_THREAD_SHUTDOWN_TIMEOUT);
    }

    private void stop(Duration joinTimeout) {
        Playback p;
        synchronized (lock) {
            p = current;
            current = null;
        }
        if (p == null) {
            return;
        }
        p.active.set(false);
        // Join outside the lock so a slow write cannot block start()
        p.thread.interrupt();
        joinThread(p.thread, joinTimeout.toMillis());
        try {
            p.output.stop();
        } catch (RuntimeException e) {
            LOG.warn("Error stopping output device: {}", e.toString());
        }
        try {
            p.output.release();
        } catch (RuntimeException e) {
            LOG.warn("Error releasing output device: {}", e.toString());
        }
        LOG.info("Playback stopped after {} chunks ({} late drops)", p.chunksPlayed, p.lateDrops);
    }

    /** @param volume linear gain, clamped to [0, 1]; applied now and to later streams */
    public void setVolume(float volume) {
        float v = Math.max(0f, Math.min(1f, volume));
        this.volume = v;
        Playback p;
        synchronized (lock) {
            p = current;
        }
        if (p != null) {
            p.output.setVolume(v);
        }
    }

    public float getVolume() {
        return volume;
    }

    public boolean isPlaying() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    /** Format being played, or {@code null} when idle. */
    public StreamConfig getCurrentConfig() {
        synchronized (lock) {
            return current == null ? null : current.config;
        }
    }

    private static void validate(StreamConfig config) {
        if (!SendspinProtocol.CODEC_PCM.equals(config.codec())) {
            throw new AudioDeviceException("UNSUPPORTED_CODEC", "Only raw PCM can be played, got " + config.codec());
        }
        if (!SUPPORTED_CHANNELS.contains(config.channels())) {
            throw new AudioDeviceException("UNSUPPORTED_FORMAT", "Unsupported channel count " + config.channels());
        }
        if (!SUPPORTED_BIT_DEPTHS.contains(config.bitDepth())) {
            throw new AudioDeviceException("UNSUPPORTED_FORMAT", "Unsupported bit depth " + config.bitDepth());
        }
    }

    private void run(Playback p) {
        try {
            prebuffer(p);
            if (!p.active.get()) {
                return;
            }
            p.output.start();
            fastForward();
            long latencyMicros = p.output.latencyMicros();
            Duration poll = Duration.ofMillis(props.getPollIntervalMs());
            while (p.active.get()) {
                Optional<AudioChunk> chunk = buffer.poll(poll);
                if (chunk.isPresent()) {
                    stateHolder.updateBufferHealth(buffer.usagePercent());
                    play(p, chunk.get(), latencyMicros);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Playback thread interrupted");
        } catch (RuntimeException e) {
            LOG.error("Playback loop failed for {}", p.config, e);
        } finally {
            p.active.set(false);
        }
    }

    private void prebuffer(Playback p) throws InterruptedException {
        int target = p.output.bufferSizeBytes();
        boolean reached = buffer.awaitBytes(target, Duration.ofMillis(props.getPrebufferTimeoutMs()));
        if (reached) {
            LOG.info("Pre-buffered {} bytes (target {})", buffer.sizeBytes(), target);
        } else {
            LOG.warn("Pre-buffer timed out; starting with {} of {} bytes", buffer.sizeBytes(), target);
        }
    }

    /** Discards queued chunks whose play time passed more than the fast-forward threshold ago. */
    void fastForward() {
        if (!clock.isSynced()) {
            return;
        }
        long threshold = TimeUtils.millisToMicros(props.getFastForwardThresholdMs());
        int skipped = 0;
        while (true) {
            Optional<AudioChunk> head = buffer.peek();
            if (head.isEmpty() || clock.delayUntil(head.get().timestampMicros()) >= -threshold) {
                break;
            }
            buffer.read();
            skipped++;
        }
        if (skipped > 0) {
            stateHolder.updateBufferHealth(buffer.usagePercent());
            metrics.incrementFastForwardDrops(skipped);
            LOG.info("Fast-forwarded past {} stale chunks", skipped);
        }
    }

    private void play(Playback p, AudioChunk chunk, long latencyMicros) throws InterruptedException {
        if (clock.isSynced()) {
            long delay = clock.delayUntil(chunk.timestampMicros() - latencyMicros);
            logSync(p, delay);
            if (delay > TimeUtils.millisToMicros(props.getEarlyThresholdMs())) {
                long sleepMs = Math.min(TimeUtils.microsToMillis(delay), props.getMaxSleepMs());
                if (sleepMs > props.getSleepMarginMs()) {
                    Thread.sleep(sleepMs - props.getSleepMarginMs());
                }
            } else if (delay < -TimeUtils.millisToMicros(props.getLateDropThresholdMs())) {
                p.lateDrops++;
                metrics.incrementLateDrop();
                if (p.lateDrops % LATE_LOG_EVERY == 1) {
                    LOG.warn("Dropping late chunk: {} ms behind ({} late so far)",
                            -TimeUtils.microsToMillis(delay), p.lateDrops);
                }
                return;
            }
        }
        write(p, chunk);
    }

    private void write(Playback p, AudioChunk chunk) {
        try {
            int written = p.output.write(chunk.data(), 0, chunk.size());
            if (written < 0) {
                onWriteError(p, "device returned " + written);
                return;
            }
            p.chunksPlayed++;
        } catch (RuntimeException e) {
            onWriteError(p, e.toString());
        }
    }

    private void onWriteError(Playback p, String detail) {
        p.writeErrors++;
        metrics.incrementWriteError();
        if (p.writeErrors % WRITE_ERROR_LOG_EVERY == 1) {
            LOG.error("Output write failed ({} so far): {}", p.writeErrors, detail);
        }
    }

    private void logSync(Playback p, long delayMicros) {
        long now = System.currentTimeMillis();
        if (now - p.lastSyncLog > SYNC_LOG_INTERVAL_MS) {
            p.lastSyncLog = now;
            LOG.debug("Sync: delay={}ms offset={}ms played={}", TimeUtils.microsToMillis(delayMicros),
                    TimeUtils.microsToMillis(clock.getOffsetMicros()), p.chunksPlayed);
        }
    }

    private static void joinThread(Thread t, long timeoutMs) {
        try {
            t.join(timeoutMs);
            if (t.isAlive()) {
                LOG.warn("Playback thread did not exit within {} ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** One stream's device and thread. Counters are touched only by the playback thread. */
    private static final class Playback {
        final StreamConfig config;
        final AudioOutput output;
        final AtomicBoolean active = new AtomicBoolean(true);
        Thread thread;
        long chunksPlayed;
        long lateDrops;
        long writeErrors;
        long lastSyncLog;

        Playback(StreamConfig config, AudioOutput output) {
            this.config = config;
            this.output = output;
        }
    }
}
