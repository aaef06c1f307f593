package com.phillippitts.sendspin.service.session;

import com.phillippitts.sendspin.config.properties.ClockSyncProperties;
import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import com.phillippitts.sendspin.service.clock.ClockSynchronizer;
import com.phillippitts.sendspin.service.metrics.PlaybackMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Groups the process-wide collaborators every {@link ConnectionStateMachine} shares, so a
 * session only needs its transport and descriptor on top.
 */
@Component
public final class SessionDependencies {
    private final ClockSynchronizer clock;
    private final AudioChunkBuffer buffer;
    private final PlayerStateHolder stateHolder;
    private final TaskScheduler scheduler;
    private final ClockSyncProperties clockSyncProperties;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    public SessionDependencies(ClockSynchronizer clock,
                               AudioChunkBuffer buffer,
                               PlayerStateHolder stateHolder,
                               @Qualifier("sendspinScheduler") TaskScheduler scheduler,
                               ClockSyncProperties clockSyncProperties,
                               ApplicationEventPublisher publisher,
                               PlaybackMetrics metrics) {
        this.clock = clock;
        this.buffer = buffer;
        this.stateHolder = stateHolder;
        this.scheduler = scheduler;
        this.clockSyncProperties = clockSyncProperties;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    public ClockSynchronizer getClock() {
        return clock;
    }

    public AudioChunkBuffer getBuffer() {
        return buffer;
    }

    public PlayerStateHolder getStateHolder() {
        return stateHolder;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public ClockSyncProperties getClockSyncProperties() {
        return clockSyncProperties;
    }

    public ApplicationEventPublisher getPublisher() {
        return publisher;
    }

    public PlaybackMetrics getMetrics() {
        return metrics;
    }
}
