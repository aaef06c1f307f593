package com.phillippitts.sendspin.service.buffer;

import com.phillippitts.sendspin.domain.AudioChunk;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioChunkBufferTest {

    private static AudioChunk chunk(long ts, int size) {
        return new AudioChunk(ts, new byte[size]);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new AudioChunkBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsChunkThatWouldOverflow() {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);

        assertThat(buffer.write(chunk(1, 600))).isTrue();
        assertThat(buffer.write(chunk(2, 500))).isFalse();
        assertThat(buffer.sizeBytes()).isEqualTo(600);
        assertThat(buffer.totalChunksRejected()).isEqualTo(1);

        assertThat(buffer.read()).map(AudioChunk::size).contains(600);
        assertThat(buffer.sizeBytes()).isZero();
        assertThat(buffer.read()).isEmpty();
    }

    @Test
    void chunkExactlyFillingCapacityIsAccepted() {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);

        assertThat(buffer.write(chunk(1, 1024))).isTrue();
        assertThat(buffer.availableBytes()).isZero();
        assertThat(buffer.usagePercent()).isEqualTo(100f);
    }

    @Test
    void readsInArrivalOrderNotTimestampOrder() {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);
        buffer.write(chunk(300, 1));
        buffer.write(chunk(100, 1));
        buffer.write(chunk(200, 1));

        assertThat(buffer.peek()).map(AudioChunk::timestampMicros).contains(300L);
        assertThat(buffer.read()).map(AudioChunk::timestampMicros).contains(300L);
        assertThat(buffer.read()).map(AudioChunk::timestampMicros).contains(100L);
        assertThat(buffer.read()).map(AudioChunk::timestampMicros).contains(200L);
    }

    @Test
    void clearDropsChunksButKeepsTotals() {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);
        buffer.write(chunk(1, 100));
        buffer.write(chunk(2, 100));

        buffer.clear();

        assertThat(buffer.sizeBytes()).isZero();
        assertThat(buffer.chunkCount()).isZero();
        assertThat(buffer.totalBytesWritten()).isEqualTo(200);

        buffer.resetStats();
        assertThat(buffer.totalBytesWritten()).isZero();
    }

    @Test
    void pollTimesOutOnEmptyBuffer() throws InterruptedException {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);

        assertThat(buffer.poll(Duration.ofMillis(20))).isEmpty();
        assertThat(buffer.awaitBytes(1, Duration.ofMillis(20))).isFalse();
    }

    @Test
    void pollWakesWhenChunkArrives() throws Exception {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<AudioChunk>> polled = exec.submit(() -> buffer.poll(Duration.ofSeconds(5)));
            Thread.sleep(20);
            buffer.write(chunk(7, 8));

            assertThat(polled.get(2, TimeUnit.SECONDS)).map(AudioChunk::timestampMicros).contains(7L);
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void awaitBytesReturnsOnceThresholdReached() throws Exception {
        AudioChunkBuffer buffer = new AudioChunkBuffer(1024);
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> reached = exec.submit(() -> buffer.awaitBytes(300, Duration.ofSeconds(5)));
            buffer.write(chunk(1, 200));
            buffer.write(chunk(2, 200));

            assertThat(reached.get(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void concurrentProducerAndConsumerConserveBytes() throws Exception {
        AudioChunkBuffer buffer = new AudioChunkBuffer(4096);
        int chunks = 2_000;
        AtomicLong consumed = new AtomicLong();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                while (done.getCount() > 0 || buffer.chunkCount() > 0) {
                    buffer.poll(Duration.ofMillis(5)).ifPresent(c -> consumed.addAndGet(c.size()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        long accepted = 0;
        for (int i = 0; i < chunks; i++) {
            if (buffer.write(chunk(i, 64))) {
                accepted += 64;
            }
            assertThat(buffer.sizeBytes()).isLessThanOrEqualTo(4096);
        }
        done.countDown();
        consumer.join(5_000);

        assertThat(consumed.get()).isEqualTo(accepted);
        assertThat(buffer.totalBytesRead()).isEqualTo(accepted);
        assertThat(buffer.totalBytesWritten()).isEqualTo(accepted);
    }
}
