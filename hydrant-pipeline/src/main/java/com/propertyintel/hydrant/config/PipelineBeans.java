package com.propertyintel.hydrant.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class PipelineBeans {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, HydrantPipelineProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getTimeout())
                .setReadTimeout(properties.getApi().getTimeout())
                .build();
    }

    /** Lineage stamps (load_date, load_timestamp) are always UTC. */
    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }
}
