package com.phillippitts.sendspin.service.session;

import com.phillippitts.sendspin.domain.PlayerState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Observable holder of the current {@link PlayerState}.
 *
 * <p>Updates are atomic swaps of immutable snapshots. Subscribers are notified synchronously
 * on the updating thread, only when the snapshot actually changed.
 */
@Component
public class PlayerStateHolder {

    private static final Logger LOG = LogManager.getLogger(PlayerStateHolder.class);
    private static final float BUFFER_HEALTH_STEP = 1.0f;

    private final AtomicReference<PlayerState> current = new AtomicReference<>(PlayerState.initial());
    private final List<Consumer<PlayerState>> listeners = new CopyOnWriteArrayList<>();

    public PlayerState get() {
        return current.get();
    }

    /**
     * Applies {@code change} atomically and notifies subscribers if the state changed.
     *
     * @return the new snapshot
     */
    public PlayerState update(UnaryOperator<PlayerState> change) {
        PlayerState prev;
        PlayerState next;
        do {
            prev = current.get();
            next = change.apply(prev);
        } while (!current.compareAndSet(prev, next));
        if (!next.equals(prev)) {
            notifyListeners(next);
        }
        return next;
    }

    /**
     * Publishes buffer usage. Changes smaller than one percentage point are skipped, except
     * that an empty buffer is always reported.
     */
    public void updateBufferHealth(float percent) {
        update(s -> percent == 0f || Math.abs(s.bufferHealthPercent() - percent) >= BUFFER_HEALTH_STEP
                ? s.withBufferHealth(percent)
                : s);
    }

    /**
     * Registers a listener for state changes.
     *
     * @return handle that removes the listener when run
     */
    public Runnable subscribe(Consumer<PlayerState> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void notifyListeners(PlayerState state) {
        for (Consumer<PlayerState> l : listeners) {
            try {
                l.accept(state);
            } catch (RuntimeException e) {
                LOG.warn("Player state listener failed: {}", e.toString(), e);
            }
        }
    }
}
