package com.demointel.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class DemographicAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemographicAnomalyApplication.class, args);
    }
}
