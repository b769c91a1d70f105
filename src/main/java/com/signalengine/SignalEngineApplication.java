package com.signalengine;

import com.signalengine.config.SignalEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties(SignalEngineProperties.class)
public class SignalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalEngineApplication.class, args);
    }
}
