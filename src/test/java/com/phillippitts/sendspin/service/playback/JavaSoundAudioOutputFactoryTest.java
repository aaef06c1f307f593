package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.config.properties.PlaybackProperties;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.exception.AudioDeviceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JavaSoundAudioOutputFactoryTest {

    private static final StreamConfig PCM = new StreamConfig("pcm", 48_000, 2, 16);

    private PlaybackProperties props;
    private SourceDataLine line;

    @BeforeEach
    void setUp() {
        props = new PlaybackProperties();
        line = mock(SourceDataLine.class);
    }

    private static DataLine.Info infoWithMinBuffer(int minBuffer) {
        return new DataLine.Info(SourceDataLine.class, new AudioFormat[0], minBuffer, minBuffer * 4);
    }

    @Test
    void minBufferUsesFallbackWhenLineReportsLess() {
        when(line.getLineInfo()).thenReturn(infoWithMinBuffer(1000));
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> line);

        // 100 ms of 48 kHz stereo 16-bit
        assertThat(factory.minBufferSize(PCM)).isEqualTo(19_200);
    }

    @Test
    void minBufferUsesLineValueFrameAligned() {
        when(line.getLineInfo()).thenReturn(infoWithMinBuffer(40_003));
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> line);

        assertThat(factory.minBufferSize(PCM)).isEqualTo(40_000);
    }

    @Test
    void opensLineAsSignedLittleEndianPcm() throws Exception {
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> line);

        AudioOutput out = factory.open(PCM, 115_201);

        assertThat(out).isInstanceOf(JavaSoundAudioOutput.class);
        verify(line).open(any(AudioFormat.class), eq(115_200));
        AudioFormat format = JavaSoundAudioOutputFactory.toAudioFormat(PCM);
        assertThat(format.getEncoding()).isEqualTo(AudioFormat.Encoding.PCM_SIGNED);
        assertThat(format.isBigEndian()).isFalse();
        assertThat(format.getChannels()).isEqualTo(2);
    }

    @Test
    void busyLineMapsToLineUnavailable() throws Exception {
        doThrow(new LineUnavailableException("busy")).when(line).open(any(AudioFormat.class), anyInt());
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> line);

        assertThatThrownBy(() -> factory.open(PCM, 1024))
                .isInstanceOf(AudioDeviceException.class)
                .extracting(e -> ((AudioDeviceException) e).getReason())
                .isEqualTo("LINE_UNAVAILABLE");
    }

    @Test
    void unsupportedFormatMapsToReason() {
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> {
            throw new IllegalArgumentException("no line matching format");
        });

        assertThatThrownBy(() -> factory.open(PCM, 1024))
                .isInstanceOf(AudioDeviceException.class)
                .extracting(e -> ((AudioDeviceException) e).getReason())
                .isEqualTo("UNSUPPORTED_FORMAT");
    }

    @Test
    void securityFailureMapsToPermissionDenied() {
        JavaSoundAudioOutputFactory factory = new JavaSoundAudioOutputFactory(props, f -> {
            throw new SecurityException("denied");
        });

        assertThatThrownBy(() -> factory.minBufferSize(PCM))
                .isInstanceOf(AudioDeviceException.class)
                .extracting(e -> ((AudioDeviceException) e).getReason())
                .isEqualTo("PERMISSION_DENIED");
    }
}
