package com.grc.riskengine;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.processing.RiskUpdateBatchProcessor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full engine against live PostgreSQL, Kafka and Redis. Tagged {@code integration},
 * which the default surefire run excludes; run it with
 * {@code mvn test -Dsurefire.excludedGroups= -Dgroups=integration} once the infrastructure is up.
 */
@Tag("integration")
@SpringBootTest(classes = DynamicRiskEngineApplication.class)
@TestPropertySource(properties = {
		"spring.kafka.bootstrap-servers=localhost:9092",
		"spring.data.redis.host=localhost",
		"spring.data.redis.port=6379",
		"dynamic-risk.processing-enabled=false"
})
class DynamicRiskEngineApplicationTests {

	@Autowired
	private RiskEngineProperties properties;

	@Autowired
	private RiskUpdateBatchProcessor batchProcessor;

	@Test
	void engineStartsWithSchedulingSwitchedOff() {
		assertThat(properties.isProcessingEnabled()).isFalse();
		assertThat(properties.getCascade().getHopDecay()).isEqualTo(0.8);
		assertThat(batchProcessor.runCycle()).isEmpty();
	}
}
