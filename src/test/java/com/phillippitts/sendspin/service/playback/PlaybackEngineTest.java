package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.config.properties.PlaybackProperties;
import com.phillippitts.sendspin.domain.AudioChunk;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import com.phillippitts.sendspin.service.clock.ClockSynchronizer;
import com.phillippitts.sendspin.service.metrics.PlaybackMetrics;
import com.phillippitts.sendspin.service.session.PlayerStateHolder;
import com.phillippitts.sendspin.testutil.EventCapturingPublisher;
import com.phillippitts.sendspin.testutil.FakeAudioOutput;
import com.phillippitts.sendspin.testutil.FakeAudioOutputFactory;
import com.phillippitts.sendspin.testutil.FakeMicrosClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class PlaybackEngineTest {

    private static final StreamConfig PCM = new StreamConfig("pcm", 48_000, 2, 16);
    private static final long NOW = 100_000_000L;

    private AudioChunkBuffer buffer;
    private FakeMicrosClock now;
    private ClockSynchronizer clock;
    private FakeAudioOutputFactory factory;
    private PlaybackProperties props;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private PlayerStateHolder stateHolder;
    private PlaybackEngine engine;

    @BeforeEach
    void setUp() {
        buffer = new AudioChunkBuffer(64 * 1024);
        now = new FakeMicrosClock(NOW);
        clock = new ClockSynchronizer(now);
        factory = new FakeAudioOutputFactory(4, 0);
        props = new PlaybackProperties();
        props.setPrebufferTimeoutMs(50);
        props.setPollIntervalMs(5);
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        stateHolder = new PlayerStateHolder();
        engine = new PlaybackEngine(buffer, clock, factory, props, publisher, new PlaybackMetrics(registry),
                stateHolder);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void syncWithZeroOffset() {
        for (int i = 0; i < ClockSynchronizer.MIN_SAMPLES_FOR_SYNC; i++) {
            clock.recordSample(0);
        }
    }

    private static AudioChunk chunk(long ts, int fill) {
        byte[] data = new byte[16];
        Arrays.fill(data, (byte) fill);
        return new AudioChunk(ts, data);
    }

    @Test
    void opensDeviceWithScaledBufferAndRemembersVolume() {
        engine.setVolume(0.25f);

        assertThat(engine.start(PCM)).isTrue();

        assertThat(factory.requestedSizes()).containsExactly(4 * props.getBufferSizeFactor());
        assertThat(factory.last().volume()).isEqualTo(0.25f);
        assertThat(engine.isPlaying()).isTrue();
        assertThat(engine.getCurrentConfig()).isEqualTo(PCM);
    }

    @Test
    void writesImmediatelyWhileClockUnsynced() {
        AudioChunk c = chunk(1L, 1);
        buffer.write(c);

        engine.start(PCM);

        FakeAudioOutput out = factory.last();
        await().atMost(Duration.ofSeconds(2)).until(() -> out.wrote(c));
        assertThat(out.isStarted()).isTrue();
    }

    @Test
    void dropsChunkScheduledTwoSecondsAgo() {
        syncWithZeroOffset();
        props.setFastForwardThresholdMs(10_000);
        AudioChunk late = chunk(NOW - 2_000_000L, 1);
        AudioChunk onTime = chunk(NOW, 2);
        buffer.write(late);
        buffer.write(onTime);

        engine.start(PCM);

        FakeAudioOutput out = factory.last();
        await().atMost(Duration.ofSeconds(2)).until(() -> out.wrote(onTime));
        assertThat(out.wrote(late)).isFalse();
        assertThat(registry.find("sendspin.playback.late.drops").counter().count()).isEqualTo(1.0);
    }

    @Test
    void slightlyLateChunkIsStillPlayed() {
        syncWithZeroOffset();
        AudioChunk c = chunk(NOW - 200_000L, 3);
        buffer.write(c);

        engine.start(PCM);

        FakeAudioOutput out = factory.last();
        await().atMost(Duration.ofSeconds(2)).until(() -> out.wrote(c));
        assertThat(registry.find("sendspin.playback.late.drops").counter().count()).isZero();
    }

    @Test
    void earlyChunkIsHeldBackUntilDue() {
        syncWithZeroOffset();
        AudioChunk early = chunk(NOW + 300_000L, 5);
        buffer.write(early);

        engine.start(PCM);

        FakeAudioOutput out = factory.last();
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> !out.wrote(early));
        await().atMost(Duration.ofSeconds(2)).until(() -> out.wrote(early));
        assertThat(registry.find("sendspin.playback.late.drops").counter().count()).isZero();
    }

    @Test
    void drainingBufferIsReportedInPlayerState() {
        buffer.write(new AudioChunk(1L, new byte[32 * 1024]));
        stateHolder.updateBufferHealth(buffer.usagePercent());
        assertThat(stateHolder.get().bufferHealthPercent()).isEqualTo(50f);

        engine.start(PCM);

        await().atMost(Duration.ofSeconds(2)).until(() -> stateHolder.get().bufferHealthPercent() == 0f);
    }

    @Test
    void fastForwardSkipsStaleHead() {
        syncWithZeroOffset();
        buffer.write(chunk(NOW - 2_000_000L, 1));
        buffer.write(chunk(NOW - 1_000_000L, 2));
        buffer.write(chunk(NOW - 100_000L, 3));
        buffer.write(chunk(NOW + 500_000L, 4));

        engine.fastForward();

        assertThat(buffer.chunkCount()).isEqualTo(2);
        assertThat(buffer.peek()).map(AudioChunk::timestampMicros).contains(NOW - 100_000L);
        assertThat(registry.find("sendspin.playback.fastforward.drops").counter().count()).isEqualTo(2.0);
    }

    @Test
    void fastForwardDoesNothingBeforeSync() {
        buffer.write(chunk(NOW - 2_000_000L, 1));

        engine.fastForward();

        assertThat(buffer.chunkCount()).isEqualTo(1);
    }

    @Test
    void deviceFailureLeavesEngineIdleAndPublishes() {
        factory.failOpens("LINE_UNAVAILABLE");

        assertThat(engine.start(PCM)).isFalse();

        assertThat(engine.isPlaying()).isFalse();
        assertThat(engine.getCurrentConfig()).isNull();
        assertThat(publisher.eventsOf(AudioDeviceErrorEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.reason()).isEqualTo("LINE_UNAVAILABLE");
                    assertThat(e.config()).isEqualTo(PCM);
                });

        factory.failOpens(null);
        assertThat(engine.start(PCM)).isTrue();
    }

    @Test
    void unsupportedFormatsAreRejectedBeforeOpening() {
        assertThat(engine.start(new StreamConfig("opus", 48_000, 2, 16))).isFalse();
        assertThat(engine.start(new StreamConfig("pcm", 48_000, 6, 16))).isFalse();
        assertThat(engine.start(new StreamConfig("pcm", 48_000, 2, 8))).isFalse();

        assertThat(factory.opened()).isEmpty();
        assertThat(publisher.eventsOf(AudioDeviceErrorEvent.class))
                .extracting(AudioDeviceErrorEvent::reason)
                .containsExactly("UNSUPPORTED_CODEC", "UNSUPPORTED_FORMAT", "UNSUPPORTED_FORMAT");
    }

    @Test
    void stopReleasesDevice() {
        engine.start(PCM);
        FakeAudioOutput out = factory.last();

        engine.stop();

        assertThat(engine.isPlaying()).isFalse();
        assertThat(out.isStopped()).isTrue();
        assertThat(out.isReleased()).isTrue();
        engine.stop();
    }

    @Test
    void restartStopsPreviousPlayback() {
        engine.start(PCM);
        FakeAudioOutput first = factory.last();

        engine.start(new StreamConfig("pcm", 44_100, 2, 16));

        assertThat(first.isReleased()).isTrue();
        assertThat(factory.opened()).hasSize(2);
        assertThat(engine.getCurrentConfig().sampleRate()).isEqualTo(44_100);
    }

    @Test
    void volumeIsClampedAndAppliedToRunningOutput() {
        engine.start(PCM);

        engine.setVolume(1.7f);
        assertThat(engine.getVolume()).isEqualTo(1.0f);
        assertThat(factory.last().volume()).isEqualTo(1.0f);

        engine.setVolume(-0.5f);
        assertThat(engine.getVolume()).isZero();
    }

    @Test
    void writeErrorsAreCountedAndPlaybackContinues() {
        engine.start(PCM);
        FakeAudioOutput out = factory.last();
        out.failWrites(true);
        buffer.write(chunk(1L, 1));

        await().atMost(Duration.ofSeconds(2))
                .until(() -> registry.find("sendspin.playback.write.errors").counter().count() >= 1.0);

        out.failWrites(false);
        AudioChunk next = chunk(2L, 2);
        buffer.write(next);
        await().atMost(Duration.ofSeconds(2)).until(() -> out.wrote(next));
        assertThat(engine.isPlaying()).isTrue();
    }
}
