package com.phillippitts.sendspin.service.orchestration;

import com.phillippitts.sendspin.config.properties.SendspinProperties;
import com.phillippitts.sendspin.domain.ConnectionState;
import com.phillippitts.sendspin.domain.PlayerState;
import com.phillippitts.sendspin.service.discovery.ServiceAdvertiser;
import com.phillippitts.sendspin.service.identity.ClientIdentityStore;
import com.phillippitts.sendspin.service.playback.AudioDeviceErrorEvent;
import com.phillippitts.sendspin.service.playback.PlaybackEngine;
import com.phillippitts.sendspin.service.protocol.DeviceInfo;
import com.phillippitts.sendspin.service.protocol.SendspinProtocol;
import com.phillippitts.sendspin.service.protocol.SupportedFormat;
import com.phillippitts.sendspin.service.session.ClientDescriptor;
import com.phillippitts.sendspin.service.session.ConnectionStateMachine;
import com.phillippitts.sendspin.service.session.PlayerStateHolder;
import com.phillippitts.sendspin.service.session.SessionDependencies;
import com.phillippitts.sendspin.service.session.SessionTransport;
import com.phillippitts.sendspin.service.session.event.MuteChangedEvent;
import com.phillippitts.sendspin.service.session.event.StreamEndedEvent;
import com.phillippitts.sendspin.service.session.event.StreamStartedEvent;
import com.phillippitts.sendspin.service.session.event.VolumeChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Top-level coordinator of the player.
 *
 * <p>Owns the single active controller session, wires session events to the playback engine
 * and keeps the player advertised over mDNS while the application runs. Transport callbacks
 * carry the transport id so callbacks from a replaced connection are ignored.
 *
 * <p>Outward hooks (stream start/end, volume, mute) are the session's Spring application
 * events; host applications listen with {@code @EventListener}.
 */
@Service
public class SendspinPlayerService implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SendspinPlayerService.class);

    private final SendspinProperties props;
    private final ClientIdentityStore identity;
    private final SessionDependencies sessionDeps;
    private final PlayerStateHolder stateHolder;
    private final PlaybackEngine playback;
    private final ServiceAdvertiser advertiser;

    private final Object lock = new Object();
    private volatile ConnectionStateMachine active;
    private volatile String deviceName;
    private volatile boolean formatFallbackRequested;
    private volatile boolean running;

    public SendspinPlayerService(SendspinProperties props,
                                 ClientIdentityStore identity,
                                 SessionDependencies sessionDeps,
                                 PlaybackEngine playback,
                                 ServiceAdvertiser advertiser) {
        this.props = Objects.requireNonNull(props);
        this.identity = Objects.requireNonNull(identity);
        this.sessionDeps = Objects.requireNonNull(sessionDeps);
        this.stateHolder = sessionDeps.getStateHolder();
        this.playback = Objects.requireNonNull(playback);
        this.advertiser = Objects.requireNonNull(advertiser);
        this.deviceName = props.getDeviceName();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        LOG.info("Sendspin player '{}' starting (client_id={}, port={}, path={})",
                deviceName, identity.getClientId(), props.getPort(), props.getPath());
        if (props.isDiscoveryEnabled()) {
            advertise();
        } else {
            LOG.info("mDNS discovery disabled; controllers must connect directly");
        }
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        ConnectionStateMachine session;
        synchronized (lock) {
            session = active;
            active = null;
        }
        if (session != null) {
            session.close();
        }
        playback.stop();
        advertiser.unregister();
        running = false;
        LOG.info("Sendspin player stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void advertise() {
        try {
            advertiser.register(deviceName, props.getPort(), props.getPath());
        } catch (IOException e) {
            // Direct connections still work without discovery
            LOG.warn("mDNS registration failed: {}", e.toString());
        }
    }

    /**
     * Makes {@code transport} the active session, closing any previous one first, and starts
     * the handshake.
     */
    public ConnectionStateMachine acceptSession(SessionTransport transport) {
        synchronized (lock) {
            ConnectionStateMachine prior = active;
            if (prior != null) {
                LOG.info("New controller connection {} replaces session {}", transport.id(), prior.getSessionId());
                // Still active while closing so its StreamEndedEvent stops playback
                prior.close();
            }
            ConnectionStateMachine session = new ConnectionStateMachine(transport, descriptor(), sessionDeps);
            active = session;
            formatFallbackRequested = false;
            session.open();
            return session;
        }
    }

    public void onText(String transportId, String text) {
        ConnectionStateMachine session = sessionFor(transportId);
        if (session != null) {
            session.onText(text);
        }
    }

    public void onBinary(String transportId, ByteBuffer frame) {
        ConnectionStateMachine session = sessionFor(transportId);
        if (session != null) {
            session.onBinary(frame);
        }
    }

    /** Transport failure or abnormal close: the session fails and is released. */
    public void onTransportError(String transportId, String reason) {
        ConnectionStateMachine session = release(transportId);
        if (session != null) {
            session.fail(reason);
        }
    }

    /** Orderly close by the controller. */
    public void onClosed(String transportId) {
        ConnectionStateMachine session = release(transportId);
        if (session != null) {
            session.close();
        }
    }

    private ConnectionStateMachine sessionFor(String transportId) {
        ConnectionStateMachine session = active;
        if (session == null || !session.getSessionId().equals(transportId)) {
            LOG.debug("Ignoring callback from inactive connection {}", transportId);
            return null;
        }
        return session;
    }

    private ConnectionStateMachine release(String transportId) {
        synchronized (lock) {
            ConnectionStateMachine session = sessionFor(transportId);
            if (session != null) {
                active = null;
            }
            return session;
        }
    }

    private boolean isActive(String sessionId) {
        ConnectionStateMachine session = active;
        return session != null && session.getSessionId().equals(sessionId);
    }

    private ClientDescriptor descriptor() {
        return new ClientDescriptor(identity.getClientId(), deviceName,
                new DeviceInfo(props.getProductName(), props.getManufacturer(), props.getSoftwareVersion()),
                SendspinProtocol.DEFAULT_FORMATS, props.getBufferCapacity());
    }

    @EventListener
    void onStreamStarted(StreamStartedEvent e) {
        if (!isActive(e.sessionId())) {
            LOG.debug("Ignoring stream start from inactive session {}", e.sessionId());
            return;
        }
        playback.start(e.config());
    }

    @EventListener
    void onStreamEnded(StreamEndedEvent e) {
        // A closing session may already be released, so this is not filtered by session
        playback.stop();
    }

    @EventListener
    void onVolumeChanged(VolumeChangedEvent e) {
        applyDeviceVolume();
    }

    @EventListener
    void onMuteChanged(MuteChangedEvent e) {
        applyDeviceVolume();
    }

    /**
     * Asks the controller for the preferred format once per session when the device could
     * not open the format it picked.
     */
    @EventListener
    void onAudioDeviceError(AudioDeviceErrorEvent e) {
        ConnectionStateMachine session = active;
        if (session == null || e.config() == null) {
            return;
        }
        SupportedFormat preferred = descriptor().preferredFormat();
        if (preferred.matches(e.config()) || formatFallbackRequested) {
            return;
        }
        formatFallbackRequested = true;
        session.requestFormat(preferred);
    }

    private void applyDeviceVolume() {
        PlayerState s = stateHolder.get();
        playback.setVolume(toLinearVolume(s.volume(), s.muted()));
    }

    /** Maps protocol volume 0-100 and mute onto linear device gain in [0, 1]. */
    static float toLinearVolume(int volume, boolean muted) {
        if (muted) {
            return 0f;
        }
        return Math.max(0, Math.min(PlayerState.MAX_VOLUME, volume)) / (float) PlayerState.MAX_VOLUME;
    }

    /** Local volume change: applied to the device and reported to the controller. */
    public void setVolume(int volume) {
        int clamped = Math.max(0, Math.min(PlayerState.MAX_VOLUME, volume));
        ConnectionStateMachine session = active;
        if (session != null) {
            session.setVolume(clamped);
        } else {
            stateHolder.update(s -> s.withVolume(clamped));
        }
        applyDeviceVolume();
    }

    /** Local mute change: applied to the device and reported to the controller. */
    public void setMuted(boolean muted) {
        ConnectionStateMachine session = active;
        if (session != null) {
            session.setMuted(muted);
        } else {
            stateHolder.update(s -> s.withMuted(muted));
        }
        applyDeviceVolume();
    }

    /**
     * Renames the player. The mDNS record is re-registered right away; controllers see the new
     * name in client/hello on their next connection.
     */
    public void setDeviceName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Device name must not be blank");
        }
        if (name.equals(deviceName)) {
            return;
        }
        deviceName = name;
        LOG.info("Device name changed to '{}'", name);
        if (running && props.isDiscoveryEnabled()) {
            advertise();
        }
    }

    public String getDeviceName() {
        return deviceName;
    }

    public PlayerState getPlayerState() {
        return stateHolder.get();
    }

    /** Connected to a controller with a synchronized clock. */
    public boolean isConnected() {
        ConnectionStateMachine session = active;
        return session != null && session.getState().isOperational();
    }

    public boolean isStreaming() {
        ConnectionStateMachine session = active;
        return session != null && session.getState() == ConnectionState.STREAMING;
    }

    /**
     * Subscribes to player state changes.
     *
     * @return handle that removes the listener when run
     */
    public Runnable subscribe(Consumer<PlayerState> listener) {
        return stateHolder.subscribe(listener);
    }
}
