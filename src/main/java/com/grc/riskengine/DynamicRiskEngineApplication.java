package com.grc.riskengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the dynamic risk engine:
 * <ul>
 *   <li>Kafka and REST ingestion into a store-backed event queue</li>
 *   <li>Scheduled batch scoring, deduplication and cascading</li>
 *   <li>Redis dedupe cache, Resilience4j around external advisory services</li>
 *   <li>OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class DynamicRiskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DynamicRiskEngineApplication.class, args);
    }
}
