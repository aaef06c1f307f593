package com.phillippitts.sendspin.config;

import com.phillippitts.sendspin.service.discovery.ServiceAdvertiser;
import com.phillippitts.sendspin.service.playback.AudioOutputFactory;
import com.phillippitts.sendspin.testutil.FakeAudioOutputFactory;
import com.phillippitts.sendspin.testutil.FakeServiceAdvertiser;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Test configuration replacing hardware and network facing beans.
 *
 * <p>Provides {@code @Primary} fakes for the audio output (no sound card on CI) and the mDNS
 * advertiser, so the context starts without touching the audio system or multicast sockets.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@literal @}SpringBootTest
 * {@literal @}Import(IntegrationTestConfiguration.class)
 * class MyIntegrationTest { ... }
 * </pre>
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public FakeAudioOutputFactory testAudioOutputFactory() {
        return new FakeAudioOutputFactory(4, 0);
    }

    @Bean
    @Primary
    public FakeServiceAdvertiser testServiceAdvertiser() {
        return new FakeServiceAdvertiser();
    }
}
