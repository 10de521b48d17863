package com.grc.riskengine.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grc.riskengine.config.RiskKafkaConfig;
import com.grc.riskengine.domain.ChangeDirection;
import com.grc.riskengine.domain.EventType;
import com.grc.riskengine.domain.NotificationPriority;
import com.grc.riskengine.domain.RiskChangeNotification;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Kafka wiring from {@link RiskKafkaConfig} against an in-process broker.
 */
@EmbeddedKafka(partitions = 1, topics = {RiskKafkaRoundTripTest.NOTIFICATIONS, RiskKafkaRoundTripTest.EVENTS})
class RiskKafkaRoundTripTest {

    static final String NOTIFICATIONS = "risk-score-changes";
    static final String EVENTS = "risk-update-events";

    private static RiskKafkaConfig config(EmbeddedKafkaBroker broker) {
        RiskKafkaConfig config = new RiskKafkaConfig();
        ReflectionTestUtils.setField(config, "bootstrapServers", broker.getBrokersAsString());
        ReflectionTestUtils.setField(config, "consumerGroup", "risk-engine-test");
        return config;
    }

    @Test
    void notificationIsPublishedAsJsonKeyedByService(EmbeddedKafkaBroker broker) throws Exception {
        RiskKafkaConfig config = config(broker);
        ObjectMapper mapper = config.riskKafkaObjectMapper();
        DefaultKafkaProducerFactory<String, RiskChangeNotification> producerFactory =
                (DefaultKafkaProducerFactory<String, RiskChangeNotification>) config.riskNotificationProducerFactory(mapper);
        KafkaTemplate<String, RiskChangeNotification> template = config.riskNotificationKafkaTemplate(producerFactory);
        RiskChangeNotificationProducer producer = new RiskChangeNotificationProducer(template);
        ReflectionTestUtils.setField(producer, "topic", NOTIFICATIONS);

        Map<String, Object> consumerProps = KafkaTestUtils.consumerProps("notification-readers", "false", broker);
        try (Consumer<String, String> consumer = new DefaultKafkaConsumerFactory<>(consumerProps,
                new StringDeserializer(), new StringDeserializer()).createConsumer()) {
            broker.consumeFromAnEmbeddedTopic(consumer, NOTIFICATIONS);

            producer.send(RiskChangeNotification.builder()
                    .notificationId("ntf-1")
                    .serviceId(3L)
                    .serviceName("billing")
                    .previousScore(50.0)
                    .currentScore(72.0)
                    .magnitude(22.0)
                    .direction(ChangeDirection.INCREASE)
                    .triggeringEventIds(List.of("evt-a", "evt-b"))
                    .priority(NotificationPriority.HIGH)
                    .createdAt(Instant.parse("2025-06-01T12:00:00Z"))
                    .build());
            template.flush();

            ConsumerRecord<String, String> record = KafkaTestUtils.getSingleRecord(consumer, NOTIFICATIONS);
            assertThat(record.key()).isEqualTo("3");
            assertThat(record.value()).contains("\"createdAt\":\"2025-06-01T12:00:00Z\"");
            RiskChangeNotification received = mapper.readValue(record.value(), RiskChangeNotification.class);
            assertThat(received.getServiceName()).isEqualTo("billing");
            assertThat(received.getMagnitude()).isEqualTo(22.0);
            assertThat(received.getTriggeringEventIds()).containsExactly("evt-a", "evt-b");
        } finally {
            producerFactory.destroy();
        }
    }

    @Test
    void inboundJsonIsReadAndUnreadableRecordsBecomeNull(EmbeddedKafkaBroker broker) {
        RiskKafkaConfig config = config(broker);

        try (Producer<String, String> raw = new KafkaProducer<>(KafkaTestUtils.producerProps(broker),
                new StringSerializer(), new StringSerializer());
             Consumer<String, RiskUpdateEventMessage> consumer = config
                     .riskUpdateEventConsumerFactory(config.riskKafkaObjectMapper()).createConsumer()) {
            broker.consumeFromAnEmbeddedTopic(consumer, EVENTS);

            raw.send(new ProducerRecord<>(EVENTS, "4",
                    "{\"eventType\":\"SERVICE_CHANGE\",\"entityId\":4,\"unknownField\":true}"));
            raw.send(new ProducerRecord<>(EVENTS, "5", "not json"));
            raw.flush();

            List<ConsumerRecord<String, RiskUpdateEventMessage>> records = new ArrayList<>();
            long deadline = System.currentTimeMillis() + 30_000;
            while (records.size() < 2 && System.currentTimeMillis() < deadline) {
                consumer.poll(Duration.ofMillis(500)).records(EVENTS).forEach(records::add);
            }
            assertThat(records).hasSize(2);
            assertThat(records.get(0).value().getEventType()).isEqualTo(EventType.SERVICE_CHANGE);
            assertThat(records.get(0).value().getEntityId()).isEqualTo(4L);
            assertThat(records.get(1).value()).isNull();
        }
    }
}
