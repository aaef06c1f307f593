package com.phillippitts.sendspin.service.session;

import com.phillippitts.sendspin.config.properties.ClockSyncProperties;
import com.phillippitts.sendspin.domain.AudioChunk;
import com.phillippitts.sendspin.domain.ConnectionState;
import com.phillippitts.sendspin.domain.PlayerState;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import com.phillippitts.sendspin.service.clock.ClockSynchronizer;
import com.phillippitts.sendspin.service.metrics.PlaybackMetrics;
import com.phillippitts.sendspin.service.protocol.MessageType;
import com.phillippitts.sendspin.service.protocol.PlayerCommand;
import com.phillippitts.sendspin.service.protocol.SendspinMessage;
import com.phillippitts.sendspin.service.protocol.SendspinProtocol;
import com.phillippitts.sendspin.service.protocol.ServerHello;
import com.phillippitts.sendspin.service.protocol.ServerTime;
import com.phillippitts.sendspin.service.protocol.StreamRoles;
import com.phillippitts.sendspin.service.protocol.SupportedFormat;
import com.phillippitts.sendspin.service.session.event.MuteChangedEvent;
import com.phillippitts.sendspin.service.session.event.SessionErrorEvent;
import com.phillippitts.sendspin.service.session.event.StreamEndedEvent;
import com.phillippitts.sendspin.service.session.event.StreamStartedEvent;
import com.phillippitts.sendspin.service.session.event.VolumeChangedEvent;
import com.phillippitts.sendspin.util.LogPreview;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives one controller session through handshake, clock sync and streaming.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING → HANDSHAKING (via open, client/hello sent)
 * HANDSHAKING → SYNCING_CLOCK (server/hello, clock sync burst started)
 * SYNCING_CLOCK → CONNECTED (first synced server/time, client/state sent)
 * CONNECTED/STREAMING → STREAMING (stream/start)
 * STREAMING → CONNECTED (stream/end)
 * any → ERROR → DISCONNECTED (via fail)
 * any → DISCONNECTED (via close)
 * </pre>
 *
 * <p>Inbound messages arrive on the transport's receive thread, clock sync requests on the
 * shared scheduler and volume/mute changes from the host. State transitions are guarded by
 * a {@link ReentrantLock}; the binary audio path only reads the volatile state and never
 * takes the lock.
 *
 * <p>Every log line emitted on behalf of the session carries the {@code sessionId} MDC key.
 *
 * @since 1.0
 */
public final class ConnectionStateMachine {

    private static final Logger LOG = LogManager.getLogger(ConnectionStateMachine.class);

    static final String MDC_SESSION_ID = "sessionId";
    private static final int OVERFLOW_LOG_EVERY = 100;
    private static final int CHUNK_LOG_EVERY = 100;
    private static final int LOG_PREVIEW_CHARS = 200;

    private final SessionTransport transport;
    private final ClientDescriptor descriptor;
    private final ClockSynchronizer clock;
    private final AudioChunkBuffer buffer;
    private final PlayerStateHolder stateHolder;
    private final TaskScheduler scheduler;
    private final ClockSyncProperties clockSync;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private final List<ScheduledFuture<?>> syncTasks = new ArrayList<>();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private StreamConfig streamConfig;

    private final AtomicLong chunksReceived = new AtomicLong();
    private final AtomicLong overflowDrops = new AtomicLong();

    public ConnectionStateMachine(SessionTransport transport,
                                  ClientDescriptor descriptor,
                                  SessionDependencies deps) {
        this.transport = Objects.requireNonNull(transport);
        this.descriptor = Objects.requireNonNull(descriptor);
        this.clock = deps.getClock();
        this.buffer = deps.getBuffer();
        this.stateHolder = deps.getStateHolder();
        this.scheduler = deps.getScheduler();
        this.clockSync = deps.getClockSyncProperties();
        this.publisher = deps.getPublisher();
        this.metrics = deps.getMetrics();
    }

    public String getSessionId() {
        return transport.id();
    }

    public ConnectionState getState() {
        return state;
    }

    /** Format of the active stream, or {@code null} outside STREAMING. */
    public StreamConfig getStreamConfig() {
        lock.lock();
        try {
            return streamConfig;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the handshake by sending client/hello.
     *
     * @throws IllegalStateException if the session was already opened
     */
    public void open() {
        inSession(() -> {
            lock.lock();
            try {
                if (state != ConnectionState.DISCONNECTED) {
                    throw new IllegalStateException("Session " + getSessionId() + " already opened (state=" + state + ")");
                }
                stateHolder.update(s -> s.withError(null));
                transitionTo(ConnectionState.CONNECTING);
                LOG.info("Session opened; sending client/hello as '{}' (client_id={})",
                        descriptor.name(), descriptor.clientId());
                String hello = SendspinProtocol.clientHello(descriptor.clientId(), descriptor.name(),
                        descriptor.deviceInfo(), descriptor.formats(), descriptor.bufferCapacity());
                if (send(hello)) {
                    transitionTo(ConnectionState.HANDSHAKING);
                }
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * Normal teardown: cancels clock sync, clears the buffer, resets the clock and closes the
     * transport. Publishes {@link StreamEndedEvent} if a stream was active.
     */
    public void close() {
        inSession(() -> {
            boolean streamWasActive;
            lock.lock();
            try {
                if (state == ConnectionState.DISCONNECTED) {
                    return;
                }
                streamWasActive = streamConfig != null;
                cleanup();
                transitionTo(ConnectionState.DISCONNECTED);
            } finally {
                lock.unlock();
            }
            closeTransport();
            LOG.info("Session closed");
            if (streamWasActive) {
                publisher.publishEvent(new StreamEndedEvent(getSessionId(), Instant.now()));
            }
        });
    }

    /**
     * Transport-level failure: records the reason, moves through ERROR, cleans up and ends in
     * DISCONNECTED. A no-op once the session is disconnected.
     */
    public void fail(String reason) {
        inSession(() -> {
            boolean streamWasActive;
            lock.lock();
            try {
                if (state == ConnectionState.DISCONNECTED || state == ConnectionState.ERROR) {
                    return;
                }
                streamWasActive = streamConfig != null;
                LOG.warn("Session failed in state {}: {}", state, reason);
                transitionTo(ConnectionState.ERROR);
                stateHolder.update(s -> s.withError(reason));
                cleanup();
                transitionTo(ConnectionState.DISCONNECTED);
            } finally {
                lock.unlock();
            }
            closeTransport();
            publisher.publishEvent(new SessionErrorEvent(getSessionId(), reason, Instant.now()));
            if (streamWasActive) {
                publisher.publishEvent(new StreamEndedEvent(getSessionId(), Instant.now()));
            }
        });
    }

    // Caller holds the lock
    private void cleanup() {
        for (ScheduledFuture<?> f : syncTasks) {
            f.cancel(false);
        }
        syncTasks.clear();
        buffer.clear();
        clock.reset();
        streamConfig = null;
        stateHolder.update(s -> s.withClockReset().withStream(null).withServer(null, null).withBufferHealth(0f));
    }

    private void closeTransport() {
        if (transport.isOpen()) {
            transport.close();
        }
    }

    /** Handles one inbound text frame. Malformed and unknown messages are dropped. */
    public void onText(String text) {
        inSession(() -> SendspinProtocol.parseMessage(text).ifPresent(this::dispatch));
    }

    private void dispatch(SendspinMessage message) {
        MessageType type = message.messageType().orElse(null);
        if (type == null) {
            LOG.debug("Ignoring unknown message type '{}'", message.type());
            return;
        }
        switch (type) {
            case SERVER_HELLO -> SendspinProtocol.parseServerHello(message.payload()).ifPresent(this::handleServerHello);
            case SERVER_TIME -> SendspinProtocol.parseServerTime(message.payload()).ifPresent(this::handleServerTime);
            case STREAM_START -> SendspinProtocol.parseStreamStart(message.payload()).ifPresent(this::handleStreamStart);
            case STREAM_CLEAR -> SendspinProtocol.parseStreamRoles(type, message.payload())
                    .ifPresent(this::handleStreamClear);
            case STREAM_END -> SendspinProtocol.parseStreamRoles(type, message.payload())
                    .ifPresent(this::handleStreamEnd);
            case SERVER_COMMAND -> SendspinProtocol.parseServerCommand(message.payload())
                    .ifPresent(this::handleServerCommand);
            case SERVER_STATE -> SendspinProtocol.parseServerState(message.payload()).ifPresent(p ->
                    LOG.debug("server/state: {}", LogPreview.truncate(p.toString(), LOG_PREVIEW_CHARS)));
            default -> LOG.debug("Ignoring client-bound type {} sent by controller", type.wireName());
        }
    }

    private void handleServerHello(ServerHello hello) {
        lock.lock();
        try {
            if (state != ConnectionState.HANDSHAKING) {
                LOG.warn("Ignoring server/hello in state {}", state);
                return;
            }
            LOG.info("Handshake complete: server='{}' id={} version={} roles={} reason={}",
                    hello.name(), hello.serverId(), hello.version(), hello.activeRoles(), hello.connectionReason());
            stateHolder.update(s -> s.withServer(hello.serverId(), hello.name()));
            transitionTo(ConnectionState.SYNCING_CLOCK);
            startClockSync();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void startClockSync() {
        Instant now = Instant.now();
        Runnable request = withSessionContext(this::sendTimeRequest);
        for (int i = 0; i < clockSync.getBurstCount(); i++) {
            syncTasks.add(scheduler.schedule(request, now.plusMillis(i * clockSync.getBurstIntervalMs())));
        }
        Duration period = Duration.ofMillis(clockSync.getResyncIntervalMs());
        syncTasks.add(scheduler.scheduleAtFixedRate(request, now.plus(period), period));
        LOG.debug("Clock sync scheduled: burst={}x{}ms, resync every {}ms",
                clockSync.getBurstCount(), clockSync.getBurstIntervalMs(), clockSync.getResyncIntervalMs());
    }

    /** Sends one client/time request; skipped unless the handshake completed. */
    void sendTimeRequest() {
        ConnectionState s = state;
        if (s != ConnectionState.SYNCING_CLOCK && !s.isOperational()) {
            return;
        }
        send(SendspinProtocol.clientTime(clock.localNowMicros()));
    }

    private void handleServerTime(ServerTime time) {
        ConnectionState s = state;
        if (s != ConnectionState.SYNCING_CLOCK && !s.isOperational()) {
            LOG.debug("Ignoring server/time in state {}", s);
            return;
        }
        clock.onTimeResponse(time.clientTransmitted(), time.serverReceived(), time.serverTransmitted());
        metrics.recordClockRtt(clock.getLastRttMicros());
        stateHolder.update(p -> p.withClock(clock.getOffsetMicros(), clock.isSynced()));

        lock.lock();
        try {
            if (state == ConnectionState.SYNCING_CLOCK && clock.isSynced()) {
                transitionTo(ConnectionState.CONNECTED);
                sendClientState();
            }
        } finally {
            lock.unlock();
        }
    }

    private void handleStreamStart(StreamConfig config) {
        lock.lock();
        try {
            if (!state.isOperational()) {
                LOG.warn("Ignoring stream/start in state {}", state);
                return;
            }
            buffer.clear();
            streamConfig = config;
            chunksReceived.set(0);
            overflowDrops.set(0);
            transitionTo(ConnectionState.STREAMING);
            stateHolder.update(s -> s.withStream(config).withBufferHealth(0f));
        } finally {
            lock.unlock();
        }
        metrics.incrementStreamsStarted();
        LOG.info("Stream started: {}", config);
        publisher.publishEvent(new StreamStartedEvent(getSessionId(), config, Instant.now()));
    }

    private void handleStreamClear(StreamRoles roles) {
        if (!roles.appliesToPlayer()) {
            LOG.debug("Ignoring stream/clear for roles {}", roles.roles());
            return;
        }
        buffer.clear();
        publishBufferHealth();
        LOG.info("Buffer cleared by controller");
    }

    private void handleStreamEnd(StreamRoles roles) {
        if (!roles.appliesToPlayer()) {
            LOG.debug("Ignoring stream/end for roles {}", roles.roles());
            return;
        }
        boolean streamWasActive;
        lock.lock();
        try {
            buffer.clear();
            streamWasActive = streamConfig != null;
            streamConfig = null;
            if (state == ConnectionState.STREAMING) {
                transitionTo(ConnectionState.CONNECTED);
            }
            stateHolder.update(s -> s.withStream(null).withBufferHealth(0f));
        } finally {
            lock.unlock();
        }
        if (streamWasActive) {
            LOG.info("Stream ended after {} chunks ({} dropped on overflow)",
                    chunksReceived.get(), overflowDrops.get());
            publisher.publishEvent(new StreamEndedEvent(getSessionId(), Instant.now()));
        }
    }

    private void handleServerCommand(PlayerCommand command) {
        switch (command.command()) {
            case PlayerCommand.VOLUME -> {
                if (command.volume() == null) {
                    LOG.warn("Ignoring volume command without volume");
                    return;
                }
                int volume = Math.max(0, Math.min(PlayerState.MAX_VOLUME, command.volume()));
                stateHolder.update(s -> s.withVolume(volume));
                LOG.info("Volume set to {} by controller", volume);
                publisher.publishEvent(new VolumeChangedEvent(getSessionId(), volume, Instant.now()));
                sendClientState();
            }
            case PlayerCommand.MUTE -> {
                if (command.mute() == null) {
                    LOG.warn("Ignoring mute command without mute flag");
                    return;
                }
                boolean muted = command.mute();
                stateHolder.update(s -> s.withMuted(muted));
                LOG.info("Mute set to {} by controller", muted);
                publisher.publishEvent(new MuteChangedEvent(getSessionId(), muted, Instant.now()));
                sendClientState();
            }
            default -> LOG.debug("Ignoring unsupported command '{}'", command.command());
        }
    }

    /**
     * Handles one inbound binary frame. Audio chunks are buffered while a stream is active;
     * everything else is dropped.
     */
    public void onBinary(ByteBuffer frame) {
        inSession(() -> {
            int type = SendspinProtocol.binaryType(frame);
            if (type != SendspinProtocol.BINARY_AUDIO) {
                LOG.debug("Ignoring binary frame of type {} ({} bytes)", type, frame.remaining());
                return;
            }
            AudioChunk chunk = SendspinProtocol.parseBinaryAudio(frame).orElse(null);
            if (chunk == null) {
                LOG.debug("Dropping truncated audio frame ({} bytes)", frame.remaining());
                return;
            }
            if (state != ConnectionState.STREAMING) {
                LOG.debug("Dropping audio chunk outside a stream (state={})", state);
                return;
            }
            long n = chunksReceived.incrementAndGet();
            if (n % CHUNK_LOG_EVERY == 1) {
                LOG.debug("Audio chunk #{}: ts={}us size={}B buffer={}%", n, chunk.timestampMicros(),
                        chunk.size(), String.format("%.1f", buffer.usagePercent()));
            }
            if (!buffer.write(chunk)) {
                metrics.incrementBufferOverflow();
                long drops = overflowDrops.incrementAndGet();
                if (drops % OVERFLOW_LOG_EVERY == 1) {
                    LOG.warn("Buffer full ({} of {} bytes); dropped {} chunk(s) so far",
                            buffer.sizeBytes(), buffer.capacity(), drops);
                }
            }
            publishBufferHealth();
        });
    }

    private void publishBufferHealth() {
        stateHolder.updateBufferHealth(buffer.usagePercent());
    }

    /** Local volume change; reported to the controller without publishing an event. */
    public void setVolume(int volume) {
        inSession(() -> {
            int clamped = Math.max(0, Math.min(PlayerState.MAX_VOLUME, volume));
            stateHolder.update(s -> s.withVolume(clamped));
            if (state.isOperational()) {
                sendClientState();
            }
        });
    }

    /** Local mute change; reported to the controller without publishing an event. */
    public void setMuted(boolean muted) {
        inSession(() -> {
            stateHolder.update(s -> s.withMuted(muted));
            if (state.isOperational()) {
                sendClientState();
            }
        });
    }

    /**
     * Asks the controller to switch the stream to {@code format}.
     *
     * @return {@code false} if the session is not connected or the send failed
     */
    public boolean requestFormat(SupportedFormat format) {
        return inSession(() -> {
            if (!state.isOperational()) {
                LOG.debug("Not requesting format {} in state {}", format, state);
                return false;
            }
            LOG.info("Requesting stream format {}", format);
            return send(SendspinProtocol.streamRequestFormat(format));
        });
    }

    private void sendClientState() {
        PlayerState s = stateHolder.get();
        String reported = state == ConnectionState.ERROR
                ? SendspinProtocol.CLIENT_STATE_ERROR
                : SendspinProtocol.CLIENT_STATE_SYNCHRONIZED;
        send(SendspinProtocol.clientState(reported, s.volume(), s.muted()));
    }

    private boolean send(String text) {
        try {
            transport.sendText(text);
            return true;
        } catch (IOException | IllegalStateException e) {
            fail("Send failed: " + e.getMessage());
            return false;
        }
    }

    // Caller holds the lock
    private void transitionTo(ConnectionState next) {
        ConnectionState prev = state;
        if (!prev.canTransitionTo(next)) {
            LOG.warn("Illegal transition {} -> {} ignored", prev, next);
            return;
        }
        state = next;
        stateHolder.update(s -> s.withConnectionState(next));
        if (prev != next) {
            LOG.info("State {} -> {}", prev, next);
        }
    }

    private Runnable withSessionContext(Runnable task) {
        return () -> inSession(task);
    }

    private void inSession(Runnable task) {
        inSession(() -> {
            task.run();
            return null;
        });
    }

    private <T> T inSession(Supplier<T> task) {
        String previous = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, getSessionId());
        try {
            return task.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previous);
            }
        }
    }
}
