package com.phillippitts.sendspin.service.clock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains the offset between the local monotonic clock and the controller clock
 * ({@code serverTime = localTime + offset}).
 *
 * <p>Each client/time round trip yields one sample:
 * <pre>
 * rtt    = (t3 - t0) - (t2 - t1)
 * offset = t2 + rtt / 2 - t3
 * </pre>
 * where t0 is the local send time, t1/t2 are the controller receive/send times and t3 is the
 * local receive time. The last {@value #MAX_SAMPLES} samples are kept and the published
 * offset is their median (upper median for even counts), which rejects single outliers.
 *
 * <p>The clock counts as synchronized once {@value #MIN_SAMPLES_FOR_SYNC} samples were
 * recorded and stays synchronized until {@link #reset()}.
 *
 * <p><b>Thread Safety:</b> samples are guarded by a lock; the published offset is an
 * {@link AtomicLong} so the playback thread reads it without locking.
 *
 * @since 1.0
 */
public final class ClockSynchronizer {

    private static final Logger LOG = LogManager.getLogger(ClockSynchronizer.class);

    public static final int MAX_SAMPLES = 10;
    public static final int MIN_SAMPLES_FOR_SYNC = 3;

    private final MicrosClock clock;
    private final Lock lock = new ReentrantLock();
    private final Deque<Long> samples = new ArrayDeque<>(MAX_SAMPLES);
    private final AtomicLong offsetMicros = new AtomicLong();
    private volatile boolean synced;
    private volatile long lastRttMicros;

    public ClockSynchronizer(MicrosClock clock) {
        this.clock = clock;
    }

    /** Current local time in microseconds. */
    public long localNowMicros() {
        return clock.nowMicros();
    }

    /**
     * Records a sample from a server/time reply received now.
     *
     * @param clientTransmitted t0, local send time echoed by the controller
     * @param serverReceived t1
     * @param serverTransmitted t2
     * @return the offset computed from this round trip
     */
    public long onTimeResponse(long clientTransmitted, long serverReceived, long serverTransmitted) {
        long clientReceived = clock.nowMicros();
        long rtt = (clientReceived - clientTransmitted) - (serverTransmitted - serverReceived);
        long offset = serverTransmitted + rtt / 2 - clientReceived;
        lastRttMicros = rtt;
        recordSample(offset);
        LOG.debug("Clock sample: rtt={}us offset={}us median={}us samples={}",
                rtt, offset, offsetMicros.get(), getSampleCount());
        return offset;
    }

    /** Adds a raw offset sample, evicting the oldest when {@value #MAX_SAMPLES} are held. */
    public void recordSample(long offset) {
        lock.lock();
        try {
            if (samples.size() == MAX_SAMPLES) {
                samples.removeFirst();
            }
            samples.addLast(offset);
            long[] sorted = samples.stream().mapToLong(Long::longValue).toArray();
            Arrays.sort(sorted);
            offsetMicros.set(sorted[sorted.length / 2]);
            if (!synced && samples.size() >= MIN_SAMPLES_FOR_SYNC) {
                synced = true;
                LOG.info("Clock synchronized: offset={}us after {} samples", sorted[sorted.length / 2],
                        samples.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Drops all samples; offset returns to 0 and the clock is unsynchronized. */
    public void reset() {
        lock.lock();
        try {
            samples.clear();
            offsetMicros.set(0);
            synced = false;
            lastRttMicros = 0;
        } finally {
            lock.unlock();
        }
    }

    public long getOffsetMicros() {
        return offsetMicros.get();
    }

    public boolean isSynced() {
        return synced;
    }

    public long getLastRttMicros() {
        return lastRttMicros;
    }

    public int getSampleCount() {
        lock.lock();
        try {
            return samples.size();
        } finally {
            lock.unlock();
        }
    }

    public long serverToLocal(long serverMicros) {
        return serverMicros - offsetMicros.get();
    }

    public long localToServer(long localMicros) {
        return localMicros + offsetMicros.get();
    }

    /**
     * Microseconds from now until the given controller time; negative when it already passed.
     */
    public long delayUntil(long serverMicros) {
        return serverToLocal(serverMicros) - clock.nowMicros();
    }
}
