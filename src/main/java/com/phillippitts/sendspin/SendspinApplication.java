package com.phillippitts.sendspin;

import com.phillippitts.sendspin.config.properties.ClockSyncProperties;
import com.phillippitts.sendspin.config.properties.PlaybackProperties;
import com.phillippitts.sendspin.config.properties.SendspinProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SendspinProperties.class,
        ClockSyncProperties.class,
        PlaybackProperties.class
})
public class SendspinApplication {

    public static void main(String[] args) {
        SpringApplication.run(SendspinApplication.class, args);
    }

}
