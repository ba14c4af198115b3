package com.automation.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * Settings under the {@code automation} prefix.
 *
 * <pre>
 * automation:
 *   engine:
 *     catalog-refresh: 5s
 *     sweep-interval: 1s
 *   events:
 *     namespace: prefect-cloud
 *   storage:
 *     type: memory
 * </pre>
 */
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    private final Engine engine = new Engine();
    private final Events events = new Events();
    private final Kafka kafka = new Kafka();
    private final Recovery recovery = new Recovery();
    private final Orchestration orchestration = new Orchestration();
    private final Notifications notifications = new Notifications();
    private final Storage storage = new Storage();

    public Engine getEngine() {
        return engine;
    }

    public Events getEvents() {
        return events;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Orchestration getOrchestration() {
        return orchestration;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Storage getStorage() {
        return storage;
    }

    public static class Engine {
        /** Maximum staleness of the cached automation set. */
        private Duration catalogRefresh = Duration.ofSeconds(5);
        /** How often expired proactive deadlines are swept. */
        private Duration sweepInterval = Duration.ofSeconds(1);
        /** Extra time an idle window is kept beyond its trigger's within. */
        private Duration windowGrace = Duration.ofMinutes(1);
        /** Number of single-threaded evaluation shards. */
        private int evaluationShards = 4;
        /** Size of the action execution pool. */
        private int actionThreads = 8;
        /** How long shutdown waits for in-flight actions. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Duration getCatalogRefresh() {
            return catalogRefresh;
        }

        public void setCatalogRefresh(Duration catalogRefresh) {
            this.catalogRefresh = catalogRefresh;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getWindowGrace() {
            return windowGrace;
        }

        public void setWindowGrace(Duration windowGrace) {
            this.windowGrace = windowGrace;
        }

        public int getEvaluationShards() {
            return evaluationShards;
        }

        public void setEvaluationShards(int evaluationShards) {
            this.evaluationShards = evaluationShards;
        }

        public int getActionThreads() {
            return actionThreads;
        }

        public void setActionThreads(int actionThreads) {
            this.actionThreads = actionThreads;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Events {
        /** Prefix of the events the engine emits about its own actions. */
        private String namespace = "prefect-cloud";
        /** HMAC key for page tokens; a random key is generated when unset. */
        private String pageTokenSecret;

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getPageTokenSecret() {
            return pageTokenSecret;
        }

        public void setPageTokenSecret(String pageTokenSecret) {
            this.pageTokenSecret = pageTokenSecret;
        }
    }

    public static class Kafka {
        /** Forwarding is enabled when this is set. */
        private String bootstrapServers;
        private String topic = "automation.events";

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public boolean isEnabled() {
            return bootstrapServers != null && !bootstrapServers.isBlank();
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        /** Invocations left in Acting longer than this are re-driven. */
        private Duration actingTimeout = Duration.ofMinutes(5);
        private Duration scanInterval = Duration.ofSeconds(30);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getActingTimeout() {
            return actingTimeout;
        }

        public void setActingTimeout(Duration actingTimeout) {
            this.actingTimeout = actingTimeout;
        }

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Orchestration {
        /** Base URL of the orchestrated system's API; the in-memory client is used when unset. */
        private URI apiUrl;
        private Duration requestTimeout = Duration.ofSeconds(10);

        public URI getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(URI apiUrl) {
            this.apiUrl = apiUrl;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Notifications {
        /** Webhook receiving notifications; notifications are only logged when unset. */
        private URI webhookUrl;

        public URI getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(URI webhookUrl) {
            this.webhookUrl = webhookUrl;
        }
    }

    public static class Storage {
        /** {@code memory} or {@code jdbc}. */
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
