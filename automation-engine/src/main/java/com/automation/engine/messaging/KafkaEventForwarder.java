package com.automation.engine.messaging;

import com.automation.core.model.Event;
import com.automation.engine.metrics.AutomationMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Forwards events to a Kafka topic as JSON, keyed by resource id so that
 * one resource's events stay ordered within a partition.
 */
public class KafkaEventForwarder implements EventForwarder {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventForwarder.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper objectMapper;
    private final AutomationMetrics metrics;

    public KafkaEventForwarder(String bootstrapServers, String topic, ObjectMapper objectMapper,
                               AutomationMetrics metrics) {
        this(new KafkaProducer<>(producerConfig(bootstrapServers)), topic, objectMapper, metrics);
    }

    public KafkaEventForwarder(Producer<String, String> producer, String topic, ObjectMapper objectMapper,
                               AutomationMetrics metrics) {
        this.producer = producer;
        this.topic = topic;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    static Properties producerConfig(String bootstrapServers) {
        Properties config = new Properties();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        config.put(ProducerConfig.ACKS_CONFIG, "all");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        config.put(ProducerConfig.LINGER_MS_CONFIG, 10);
        config.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 2000);
        return config;
    }

    @Override
    public void forward(List<Event> events) {
        for (Event event : events) {
            String value;
            try {
                value = objectMapper.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                log.error("Cannot serialize event {} for forwarding", event.id(), e);
                metrics.eventForwarded(false);
                continue;
            }
            try {
                producer.send(new ProducerRecord<>(topic, event.resourceId(), value), (metadata, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to forward event {} to {}: {}", event.id(), topic, ex.getMessage());
                        metrics.eventForwarded(false);
                    } else {
                        metrics.eventForwarded(true);
                    }
                });
            } catch (RuntimeException e) {
                log.warn("Failed to forward event {} to {}: {}", event.id(), topic, e.getMessage());
                metrics.eventForwarded(false);
            }
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(5));
    }
}
