package com.glimpse.payment.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class PaymentRetrySweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(PaymentRetrySweepScheduler.class);

    private final PaymentRetryOrchestrator orchestrator;

    public PaymentRetrySweepScheduler(PaymentRetryOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(cron = "${payment.retry.sweep-cron:0 */10 * * * *}")
    public void sweep() {
        try {
            int resumed = orchestrator.processPendingRetries();
            if (resumed > 0) {
                log.info("Payment retry sweep resumed={}", resumed);
            }
        } catch (Exception e) {
            log.error("Payment retry sweep failed", e);
        }
    }
}
