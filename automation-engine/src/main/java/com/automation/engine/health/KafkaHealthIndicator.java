package com.automation.engine.health;

import com.automation.engine.config.AutomationProperties;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for the Kafka event forwarder.
 * Forwarding is best effort, so an unreachable broker is reported but never fails health.
 */
public class KafkaHealthIndicator implements HealthIndicator {

    private final AutomationProperties.Kafka kafka;

    public KafkaHealthIndicator(AutomationProperties properties) {
        this.kafka = properties.getKafka();
    }

    @Override
    public Health health() {
        if (!kafka.isEnabled()) {
            return Health.up()
                .withDetail("kafka", "disabled")
                .build();
        }

        Map<String, Object> details = new HashMap<>();
        details.put("bootstrapServers", kafka.getBootstrapServers());
        details.put("topic", kafka.getTopic());

        Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, "5000");
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, "5000");

        try (AdminClient adminClient = AdminClient.create(props)) {
            var nodes = adminClient.describeCluster().nodes().get(5, TimeUnit.SECONDS);
            details.put("brokerCount", nodes.size());
            details.put("status", "connected");
            return Health.up().withDetails(details).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            details.put("status", "interrupted");
            return Health.unknown().withDetails(details).build();
        } catch (Exception e) {
            details.put("status", "disconnected");
            details.put("error", e.getMessage());
            return Health.up()
                .withDetails(details)
                .withDetail("forwarding", "events are stored but not forwarded")
                .build();
        }
    }
}
