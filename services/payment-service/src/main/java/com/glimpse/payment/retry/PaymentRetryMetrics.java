package com.glimpse.payment.retry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class PaymentRetryMetrics {

    private final Counter attempts;
    private final Counter succeeded;
    private final Counter scheduled;
    private final Counter exhausted;
    private final Counter clientFailures;
    private final Counter circuitRejected;
    private final Counter sweepResumed;

    public PaymentRetryMetrics(MeterRegistry registry) {
        this.attempts = Counter.builder("payment.retry.attempts").register(registry);
        this.succeeded = Counter.builder("payment.retry.succeeded").register(registry);
        this.scheduled = Counter.builder("payment.retry.scheduled").register(registry);
        this.exhausted = Counter.builder("payment.retry.exhausted").register(registry);
        this.clientFailures = Counter.builder("payment.retry.client_failures").register(registry);
        this.circuitRejected = Counter.builder("payment.retry.circuit_rejected").register(registry);
        this.sweepResumed = Counter.builder("payment.retry.sweep.resumed").register(registry);
    }

    public void incAttempts() { attempts.increment(); }
    public void incSucceeded() { succeeded.increment(); }
    public void incScheduled() { scheduled.increment(); }
    public void incExhausted() { exhausted.increment(); }
    public void incClientFailures() { clientFailures.increment(); }
    public void incCircuitRejected() { circuitRejected.increment(); }
    public void incSweepResumed() { sweepResumed.increment(); }
}
