package com.glimpse.messaging.api;

import com.glimpse.messaging.api.dto.EnqueueOfflineMessageRequest;
import com.glimpse.messaging.api.dto.QueueStats;
import com.glimpse.messaging.queue.BatchJobQueue;
import com.glimpse.messaging.queue.DelayedJobQueue;
import com.glimpse.messaging.queue.OfflineMessageQueue;
import com.glimpse.messaging.queue.PushRetryQueue;
import com.glimpse.messaging.queue.QueueMessage;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/messages")
public class MessagingController {

    private final OfflineMessageQueue offlineQueue;
    private final PushRetryQueue pushRetryQueue;
    private final DelayedJobQueue delayedJobQueue;
    private final BatchJobQueue batchJobQueue;

    public MessagingController(OfflineMessageQueue offlineQueue,
                               PushRetryQueue pushRetryQueue,
                               DelayedJobQueue delayedJobQueue,
                               BatchJobQueue batchJobQueue) {
        this.offlineQueue = offlineQueue;
        this.pushRetryQueue = pushRetryQueue;
        this.delayedJobQueue = delayedJobQueue;
        this.batchJobQueue = batchJobQueue;
    }

    @PostMapping("/offline/{recipientId}")
    public ResponseEntity<QueueMessage> enqueue(@PathVariable("recipientId") String recipientId,
                                                @Valid @RequestBody EnqueueOfflineMessageRequest request) {
        Duration ttl = request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
        QueueMessage queued = offlineQueue.enqueueOfflineMessage(recipientId, request.message(), request.type(), ttl);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queued);
    }

    @GetMapping("/offline/{recipientId}")
    public List<QueueMessage> drain(@PathVariable("recipientId") String recipientId) {
        return offlineQueue.drainOfflineMessages(recipientId);
    }

    @DeleteMapping("/offline/{recipientId}")
    public ResponseEntity<Void> clear(@PathVariable("recipientId") String recipientId) {
        offlineQueue.clearOfflineMessages(recipientId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return new QueueStats(offlineQueue.queueCount(), pushRetryQueue.pending().size(),
                delayedJobQueue.size(), batchJobQueue.queueSizes());
    }
}
