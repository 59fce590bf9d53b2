package io.mediaplatform.spring.boot;

import io.mediaplatform.jdbc.TableNames;
import io.mediaplatform.producer.ProducerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the media outbox.
 *
 * @see MediaOutboxAutoConfiguration
 */
@ConfigurationProperties(prefix = "media.outbox")
public class MediaOutboxProperties {

    /**
     * Table holding outbox records.
     */
    private String outboxTable = TableNames.DEFAULT_OUTBOX_TABLE;

    /**
     * Table holding media assets.
     */
    private String mediaTable = TableNames.DEFAULT_MEDIA_TABLE;

    private final Kafka kafka = new Kafka();
    private final Publisher publisher = new Publisher();
    private final ClaimLocking claimLocking = new ClaimLocking();
    private final Metrics metrics = new Metrics();

    public String getOutboxTable() {
        return outboxTable;
    }

    public void setOutboxTable(String outboxTable) {
        this.outboxTable = outboxTable;
    }

    public String getMediaTable() {
        return mediaTable;
    }

    public void setMediaTable(String mediaTable) {
        this.mediaTable = mediaTable;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public ClaimLocking getClaimLocking() {
        return claimLocking;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Kafka {
        /**
         * Bootstrap broker endpoints, host:port.
         */
        private List<String> brokers = new ArrayList<>();
        /**
         * Destination topic for media events.
         */
        private String topic;
        private int maxRetries = ProducerConfig.DEFAULT_MAX_RETRIES;
        private Duration retryBackoff = ProducerConfig.DEFAULT_RETRY_BACKOFF;
        private Duration writeTimeout = ProducerConfig.DEFAULT_WRITE_TIMEOUT;
        private int batchSize = ProducerConfig.DEFAULT_BATCH_SIZE;
        /**
         * Return once records are buffered instead of waiting for acknowledgement.
         */
        private boolean async = false;
        private Duration closeTimeout = ProducerConfig.DEFAULT_CLOSE_TIMEOUT;
        /**
         * Extra Kafka producer settings, passed through unchanged.
         */
        private Map<String, String> properties = new LinkedHashMap<>();

        public List<String> getBrokers() {
            return brokers;
        }

        public void setBrokers(List<String> brokers) {
            this.brokers = brokers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getWriteTimeout() {
            return writeTimeout;
        }

        public void setWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public Duration getCloseTimeout() {
            return closeTimeout;
        }

        public void setCloseTimeout(Duration closeTimeout) {
            this.closeTimeout = closeTimeout;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }
    }

    public static class Publisher {
        /**
         * Whether to run the background publisher in this instance.
         */
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class ClaimLocking {
        private boolean enabled = false;
        private String ownerId = "";
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "media.outbox";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
