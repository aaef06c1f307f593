package com.phillippitts.sendspin.service.playback;

import com.phillippitts.sendspin.domain.StreamConfig;
import com.phillippitts.sendspin.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.FloatControl;
import javax.sound.sampled.SourceDataLine;

/**
 * {@link AudioOutput} over a Java Sound {@link SourceDataLine}.
 *
 * <p>Volume uses the line's {@code MASTER_GAIN} control when present. Lines without it get
 * software gain, which is only applied to 16-bit PCM; other depths play at full level.
 */
final class JavaSoundAudioOutput implements AudioOutput {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioOutput.class);

    private final SourceDataLine line;
    private final StreamConfig config;
    private final FloatControl gain;
    private volatile float softwareVolume = 1.0f;

    JavaSoundAudioOutput(SourceDataLine line, StreamConfig config) {
        this.line = line;
        this.config = config;
        this.gain = line.isControlSupported(FloatControl.Type.MASTER_GAIN)
                ? (FloatControl) line.getControl(FloatControl.Type.MASTER_GAIN)
                : null;
        if (gain == null && config.bitDepth() != 16) {
            LOG.info("Line has no gain control; volume changes are ignored for {}-bit audio", config.bitDepth());
        }
    }

    @Override
    public void start() {
        line.start();
    }

    @Override
    public int write(byte[] data, int offset, int length) {
        float v = softwareVolume;
        if (gain == null && v < 1.0f && config.bitDepth() == 16) {
            byte[] scaled = scalePcm16(data, offset, length, v);
            return line.write(scaled, 0, scaled.length);
        }
        return line.write(data, offset, length);
    }

    @Override
    public void stop() {
        line.stop();
        line.flush();
    }

    @Override
    public void release() {
        line.close();
    }

    @Override
    public void setVolume(float volume) {
        float v = Math.max(0f, Math.min(1f, volume));
        if (gain != null) {
            gain.setValue(toDecibels(v, gain.getMinimum(), gain.getMaximum()));
        } else {
            softwareVolume = v;
        }
    }

    @Override
    public long latencyMicros() {
        return TimeUtils.pcmDurationMicros(line.getBufferSize(), config.byteRate());
    }

    @Override
    public int bufferSizeBytes() {
        return line.getBufferSize();
    }

    static float toDecibels(float linear, float minDb, float maxDb) {
        if (linear <= 0f) {
            return minDb;
        }
        float db = (float) (20.0 * Math.log10(linear));
        return Math.max(minDb, Math.min(maxDb, db));
    }

    /** Scales signed 16-bit little-endian samples by {@code factor} into a new array. */
    static byte[] scalePcm16(byte[] data, int offset, int length, float factor) {
        byte[] out = new byte[length - (length % 2)];
        for (int i = 0; i < out.length; i += 2) {
            int sample = (short) ((data[offset + i] & 0xFF) | (data[offset + i + 1] << 8));
            int scaled = Math.round(sample * factor);
            out[i] = (byte) scaled;
            out[i + 1] = (byte) (scaled >> 8);
        }
        return out;
    }
}
