package com.glimpse.messaging.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "messaging")
public class MessagingQueueProperties {

    private final Offline offline = new Offline();
    private final Push push = new Push();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Jobs jobs = new Jobs();

    public Offline getOffline() {
        return offline;
    }

    public Push getPush() {
        return push;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public static class Offline {

        private Duration ttl = Duration.ofDays(7);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Push {

        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(60);
        private String queueKey = "push_notification_retry_queue";
        private long pollIntervalMs = 30_000;
        private boolean pollEnabled = true;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public String getQueueKey() {
            return queueKey;
        }

        public void setQueueKey(String queueKey) {
            this.queueKey = queueKey;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public boolean isPollEnabled() {
            return pollEnabled;
        }

        public void setPollEnabled(boolean pollEnabled) {
            this.pollEnabled = pollEnabled;
        }
    }

    public static class DeadLetter {

        private Duration ttl = Duration.ofDays(30);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Jobs {

        private String delayedKey = "delayed_jobs";
        private int delayedBatchSize = 20;
        private boolean delayedPollEnabled = true;
        private Duration batchTtl = Duration.ofDays(1);
        private int batchSize = 10;

        public String getDelayedKey() {
            return delayedKey;
        }

        public void setDelayedKey(String delayedKey) {
            this.delayedKey = delayedKey;
        }

        public int getDelayedBatchSize() {
            return delayedBatchSize;
        }

        public void setDelayedBatchSize(int delayedBatchSize) {
            this.delayedBatchSize = delayedBatchSize;
        }

        public boolean isDelayedPollEnabled() {
            return delayedPollEnabled;
        }

        public void setDelayedPollEnabled(boolean delayedPollEnabled) {
            this.delayedPollEnabled = delayedPollEnabled;
        }

        public Duration getBatchTtl() {
            return batchTtl;
        }

        public void setBatchTtl(Duration batchTtl) {
            this.batchTtl = batchTtl;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
