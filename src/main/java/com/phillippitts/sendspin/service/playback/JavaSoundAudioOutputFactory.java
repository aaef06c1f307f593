package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.config.properties.PlaybackProperties;
import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.exception.AudioDeviceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import java.util.Objects;

/**
 * Opens {@link SourceDataLine}s on the default mixer for signed little-endian PCM.
 *
 * <p>This is the default implementation of {@link AudioOutputFactory}.
 * Test configurations can provide alternative implementations by marking them as @Primary.
 */
@Component
public class JavaSoundAudioOutputFactory implements AudioOutputFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioOutputFactory.class);

    /** Abstraction to obtain a SourceDataLine (for testing). */
    public interface LineProvider {
        SourceDataLine getLine(AudioFormat format) throws LineUnavailableException;
    }

    private final PlaybackProperties props;
    private final LineProvider provider;

    @Autowired
    public JavaSoundAudioOutputFactory(PlaybackProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioOutputFactory(PlaybackProperties props, LineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static LineProvider defaultProvider() {
        return format -> (SourceDataLine) AudioSystem.getLine(new DataLine.Info(SourceDataLine.class, format));
    }

    static AudioFormat toAudioFormat(StreamConfig config) {
        return new AudioFormat(config.sampleRate(), config.bitDepth(), config.channels(), true, false);
    }

    @Override
    public int minBufferSize(StreamConfig config) {
        int fallback = alignToFrame((int) ((long) config.byteRate() * props.getFallbackMinBufferMillis() / 1000),
                config.frameSize());
        SourceDataLine line = obtainLine(config);
        int reported = line.getLineInfo() instanceof DataLine.Info info ? info.getMinBufferSize() : AudioSystem.NOT_SPECIFIED;
        LOG.debug("Line reports min buffer {} bytes; fallback {} bytes", reported, fallback);
        return Math.max(fallback, alignToFrame(reported, config.frameSize()));
    }

    @Override
    public AudioOutput open(StreamConfig config, int bufferSizeBytes) {
        SourceDataLine line = obtainLine(config);
        try {
            line.open(toAudioFormat(config), alignToFrame(bufferSizeBytes, config.frameSize()));
        } catch (LineUnavailableException e) {
            throw new AudioDeviceException("LINE_UNAVAILABLE", "Output line busy for " + config, e);
        } catch (IllegalArgumentException e) {
            throw new AudioDeviceException("UNSUPPORTED_FORMAT", "Output line rejected " + config, e);
        } catch (SecurityException e) {
            throw new AudioDeviceException("PERMISSION_DENIED", "Not allowed to open audio output", e);
        }
        LOG.info("Opened output line: {} Hz, {} ch, {}-bit, buffer={} bytes", config.sampleRate(),
                config.channels(), config.bitDepth(), line.getBufferSize());
        return new JavaSoundAudioOutput(line, config);
    }

    private SourceDataLine obtainLine(StreamConfig config) {
        try {
            return provider.getLine(toAudioFormat(config));
        } catch (LineUnavailableException e) {
            throw new AudioDeviceException("LINE_UNAVAILABLE", "No output line for " + config, e);
        } catch (IllegalArgumentException e) {
            throw new AudioDeviceException("UNSUPPORTED_FORMAT", "No output line supports " + config, e);
        } catch (SecurityException e) {
            throw new AudioDeviceException("PERMISSION_DENIED", "Not allowed to open audio output", e);
        }
    }

    private static int alignToFrame(int bytes, int frameSize) {
        return bytes <= 0 ? 0 : bytes - (bytes % frameSize);
    }
}
