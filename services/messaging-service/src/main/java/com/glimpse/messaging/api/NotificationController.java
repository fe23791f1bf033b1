package com.glimpse.messaging.api;

import com.glimpse.messaging.api.dto.PushRetryRequest;
import com.glimpse.messaging.api.dto.PushRetryResponse;
import com.glimpse.messaging.queue.DeadLetterLog;
import com.glimpse.messaging.queue.FailedNotification;
import com.glimpse.messaging.queue.PushNotification;
import com.glimpse.messaging.queue.PushRetryQueue;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final PushRetryQueue pushRetryQueue;
    private final DeadLetterLog deadLetterLog;

    public NotificationController(PushRetryQueue pushRetryQueue, DeadLetterLog deadLetterLog) {
        this.pushRetryQueue = pushRetryQueue;
        this.deadLetterLog = deadLetterLog;
    }

    @PostMapping("/retries")
    public ResponseEntity<PushRetryResponse> enqueueRetry(@Valid @RequestBody PushRetryRequest request) {
        boolean queued = pushRetryQueue.enqueueRetry(new PushNotification(
                request.recipientId(), request.title(), request.body(), request.data(), request.attempts()));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new PushRetryResponse(request.recipientId(), queued, !queued));
    }

    @GetMapping("/dead-letters/{date}")
    public List<FailedNotification> deadLetters(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return deadLetterLog.list(date);
    }
}
