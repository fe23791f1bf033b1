package com.glimpse.payment.api;

import com.glimpse.payment.api.dto.PaymentResponse;
import com.glimpse.payment.api.dto.PaymentStatusResponse;
import com.glimpse.payment.api.dto.ProcessPaymentRequest;
import com.glimpse.payment.domain.PaymentStatusRecord;
import com.glimpse.payment.infrastructure.PaymentStatusRepository;
import com.glimpse.payment.processor.PaymentResult;
import com.glimpse.payment.retry.CircuitBreakerState;
import com.glimpse.payment.retry.PaymentContext;
import com.glimpse.payment.retry.PaymentRetryOrchestrator;
import com.glimpse.payment.retry.PendingRetry;
import com.glimpse.payment.retry.RetryState;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/payments")
public class PaymentController {

    private final PaymentRetryOrchestrator orchestrator;
    private final PaymentStatusRepository statusRepository;

    public PaymentController(PaymentRetryOrchestrator orchestrator, PaymentStatusRepository statusRepository) {
        this.orchestrator = orchestrator;
        this.statusRepository = statusRepository;
    }

    @PostMapping("/{operationId}/process")
    public ResponseEntity<PaymentResponse> process(@PathVariable("operationId") String operationId,
                                                   @Valid @RequestBody ProcessPaymentRequest request) {
        PaymentResult result = orchestrator.runWithRetry(operationId,
                new PaymentContext(request.userId(), request.provider(), request.data()));
        return ResponseEntity.ok(new PaymentResponse(
                operationId,
                result.status(),
                result.transactionId(),
                result.details(),
                null,
                null
        ));
    }

    @GetMapping("/{operationId}")
    public ResponseEntity<PaymentStatusResponse> status(@PathVariable("operationId") String operationId) {
        Optional<PaymentStatusRecord> record = statusRepository.find(operationId);
        if (record.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        RetryState retry = orchestrator.retryState(operationId).orElse(null);
        PaymentStatusRecord r = record.get();
        return ResponseEntity.ok(new PaymentStatusResponse(operationId, r.status(), r.transactionId(), r.reason(), r.updatedAt(), retry));
    }

    @GetMapping("/retries/pending")
    public List<PendingRetry> pendingRetries() {
        return orchestrator.getPendingRetries();
    }

    @GetMapping("/providers/{provider}/circuit")
    public CircuitBreakerState circuit(@PathVariable("provider") String provider) {
        return orchestrator.circuitState(provider);
    }
}
