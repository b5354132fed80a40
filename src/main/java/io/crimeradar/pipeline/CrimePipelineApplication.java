package io.crimeradar.pipeline;

import io.crimeradar.pipeline.config.PipelineConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableRetry
@EnableScheduling
@EnableConfigurationProperties(PipelineConfig.class)
@ConfigurationPropertiesScan
public class CrimePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrimePipelineApplication.class, args);
    }
}
