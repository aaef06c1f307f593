package com.phillippitts.sendspin.config;

import com.phillippitts.sendspin.config.properties.SendspinProperties;
import com.phillippitts.sendspin.service.buffer.AudioChunkBuffer;
import com.phillippitts.sendspin.service.clock.ClockSynchronizer;
import com.phillippitts.sendspin.service.clock.MicrosClock;
import com.phillippitts.sendspin.service.clock.SystemMicrosClock;
import com.phillippitts.sendspin.service.metrics.PlaybackMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared player state: the clock and the ring buffer that sessions and the playback engine
 * hand audio through.
 */
@Configuration
public class PlayerConfig {

    @Bean
    public MicrosClock microsClock() {
        return new SystemMicrosClock();
    }

    @Bean
    public ClockSynchronizer clockSynchronizer(MicrosClock microsClock) {
        return new ClockSynchronizer(microsClock);
    }

    @Bean
    public AudioChunkBuffer audioChunkBuffer(SendspinProperties props, PlaybackMetrics metrics) {
        AudioChunkBuffer buffer = new AudioChunkBuffer(props.getBufferCapacity());
        metrics.bindBuffer(buffer);
        return buffer;
    }
}
