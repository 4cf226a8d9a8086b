package com.errorengine;

import com.errorengine.config.ErrorEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ErrorEngineProperties.class)
public class ErrorEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErrorEngineApplication.class, args);
    }
}
