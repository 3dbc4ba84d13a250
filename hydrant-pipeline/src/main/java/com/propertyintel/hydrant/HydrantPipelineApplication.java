package com.propertyintel.hydrant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class HydrantPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydrantPipelineApplication.class, args);
    }
}
