package com.phillippitts.sendspin.service.buffer;

import com.phillippitts.sendspin.domain.AudioChunk;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of audio chunks between the WebSocket receive path and the playback thread.
 *
 * <p>The bound is in payload bytes. A write that would exceed it is rejected and leaves the
 * buffer untouched (drop-newest). Chunks come out strictly in write order.
 *
 * <p>Thread-safe for one producer and one consumer. Waiting helpers are bounded and woken
 * by every write and by {@link #clear()}.
 *
 * @since 1.0
 */
public final class AudioChunkBuffer {

    public static final int DEFAULT_CAPACITY_BYTES = 4 * 1024 * 1024;

    private final int capacityBytes;
    private final Lock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<AudioChunk> chunks = new ArrayDeque<>();
    private long sizeBytes;

    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicLong chunksRejected = new AtomicLong();

    public AudioChunkBuffer() {
        this(DEFAULT_CAPACITY_BYTES);
    }

    public AudioChunkBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be > 0, got: " + capacityBytes);
        }
        this.capacityBytes = capacityBytes;
    }

    /**
     * Appends a chunk if it fits.
     *
     * @return {@code false} if the chunk would push the buffer over capacity
     */
    public boolean write(AudioChunk chunk) {
        lock.lock();
        try {
            if (sizeBytes + chunk.size() > capacityBytes) {
                chunksRejected.incrementAndGet();
                return false;
            }
            chunks.addLast(chunk);
            sizeBytes += chunk.size();
            bytesWritten.addAndGet(chunk.size());
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns the oldest chunk. */
    public Optional<AudioChunk> read() {
        lock.lock();
        try {
            return Optional.ofNullable(removeFirst());
        } finally {
            lock.unlock();
        }
    }

    /** Returns the oldest chunk without removing it. */
    public Optional<AudioChunk> peek() {
        lock.lock();
        try {
            return Optional.ofNullable(chunks.peekFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest chunk, waiting up to {@code timeout} for one to arrive.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<AudioChunk> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (chunks.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
            return Optional.ofNullable(removeFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until at least {@code minBytes} are buffered or the timeout elapses.
     *
     * @return {@code true} if the threshold was reached
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitBytes(long minBytes, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (sizeBytes < minBytes) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Discards every buffered chunk. Cumulative counters are kept. */
    public void clear() {
        lock.lock();
        try {
            chunks.clear();
            sizeBytes = 0;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long sizeBytes() {
        lock.lock();
        try {
            return sizeBytes;
        } finally {
            lock.unlock();
        }
    }

    public long availableBytes() {
        return capacityBytes - sizeBytes();
    }

    /** Buffered bytes as a percentage of capacity, 0-100. */
    public float usagePercent() {
        return sizeBytes() * 100f / capacityBytes;
    }

    public int chunkCount() {
        lock.lock();
        try {
            return chunks.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacityBytes;
    }

    public long totalBytesWritten() {
        return bytesWritten.get();
    }

    public long totalBytesRead() {
        return bytesRead.get();
    }

    public long totalChunksRejected() {
        return chunksRejected.get();
    }

    public void resetStats() {
        bytesWritten.set(0);
        bytesRead.set(0);
        chunksRejected.set(0);
    }

    // Caller holds the lock
    private AudioChunk removeFirst() {
        AudioChunk chunk = chunks.pollFirst();
        if (chunk != null) {
            sizeBytes -= chunk.size();
            bytesRead.addAndGet(chunk.size());
        }
        return chunk;
    }
}
