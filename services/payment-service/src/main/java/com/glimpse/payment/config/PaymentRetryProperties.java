package com.glimpse.payment.config;

import com.glimpse.payment.retry.RetryConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "payment.retry")
public class PaymentRetryProperties {

    private int maxRetries = 3;
    private Duration initialDelay = Duration.ofSeconds(5);
    private Duration maxDelay = Duration.ofMinutes(5);
    private double backoffFactor = 2.0;
    private double jitterRatio = 0.1;

    private Duration stateTtl = Duration.ofHours(24);
    private Duration statusTtl = Duration.ofDays(30);
    private Duration failureRecordTtl = Duration.ofDays(30);

    private boolean sweepEnabled = true;
    private String sweepCron = "0 */10 * * * *";

    private final Breaker breaker = new Breaker();
    private final Webhook webhook = new Webhook();

    public RetryConfig toRetryConfig() {
        return new RetryConfig(maxRetries, initialDelay, maxDelay, backoffFactor);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = backoffFactor;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public Duration getStateTtl() {
        return stateTtl;
    }

    public void setStateTtl(Duration stateTtl) {
        this.stateTtl = stateTtl;
    }

    public Duration getStatusTtl() {
        return statusTtl;
    }

    public void setStatusTtl(Duration statusTtl) {
        this.statusTtl = statusTtl;
    }

    public Duration getFailureRecordTtl() {
        return failureRecordTtl;
    }

    public void setFailureRecordTtl(Duration failureRecordTtl) {
        this.failureRecordTtl = failureRecordTtl;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }

    public String getSweepCron() {
        return sweepCron;
    }

    public void setSweepCron(String sweepCron) {
        this.sweepCron = sweepCron;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public static class Breaker {

        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofMinutes(5);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    public static class Webhook {

        private int maxAttempts = 3;
        private Duration stateTtl = Duration.ofHours(24);
        private Duration deadLetterTtl = Duration.ofDays(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getStateTtl() {
            return stateTtl;
        }

        public void setStateTtl(Duration stateTtl) {
            this.stateTtl = stateTtl;
        }

        public Duration getDeadLetterTtl() {
            return deadLetterTtl;
        }

        public void setDeadLetterTtl(Duration deadLetterTtl) {
            this.deadLetterTtl = deadLetterTtl;
        }
    }
}
