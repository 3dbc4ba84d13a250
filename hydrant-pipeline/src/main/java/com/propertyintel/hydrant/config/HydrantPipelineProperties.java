package com.propertyintel.hydrant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hydrant-pipeline")
@Data
public class HydrantPipelineProperties {

    private Api api = new Api();
    private Storage storage = new Storage();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        /** Cincinnati Open Data hydrant dataset (Socrata JSON endpoint) */
        private String url = "https://data.cincinnati-oh.gov/resource/qhw6-ujsg.json";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Storage {
        private String rawDir = "data/raw";
        private String processedDir = "data/processed";
    }

    @Data
    public static class Output {
        private OutputFormat format = OutputFormat.PARQUET;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean includeHeader = true;
        }

        public enum OutputFormat {
            PARQUET, CSV
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 6 * * ?";
        private boolean enabled = false;
        private boolean runOnStartup = true;
    }
}
