package com.glimpse.messaging.api;

import com.glimpse.messaging.api.dto.EnqueueBatchJobRequest;
import com.glimpse.messaging.api.dto.ScheduleDelayedJobRequest;
import com.glimpse.messaging.queue.BatchJobQueue;
import com.glimpse.messaging.queue.DelayedJobQueue;
import com.glimpse.messaging.queue.QueueMessage;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final DelayedJobQueue delayedJobQueue;
    private final BatchJobQueue batchJobQueue;

    public JobController(DelayedJobQueue delayedJobQueue, BatchJobQueue batchJobQueue) {
        this.delayedJobQueue = delayedJobQueue;
        this.batchJobQueue = batchJobQueue;
    }

    @PostMapping("/delayed")
    public ResponseEntity<QueueMessage> scheduleDelayed(@Valid @RequestBody ScheduleDelayedJobRequest request) {
        QueueMessage job = delayedJobQueue.scheduleDelayedJob(request.type(), request.data(),
                Duration.ofMillis(request.delayMs()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @PostMapping("/batch/{jobType}")
    public ResponseEntity<QueueMessage> enqueueBatch(@PathVariable("jobType") String jobType,
                                                     @Valid @RequestBody EnqueueBatchJobRequest request) {
        Duration ttl = request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(batchJobQueue.enqueueBatchJob(jobType, request.data(), ttl));
    }

    /**
     * Takes the next batch of jobs off the queue; taken jobs are not returned again.
     */
    @PostMapping("/batch/{jobType}/process")
    public List<QueueMessage> processBatch(@PathVariable("jobType") String jobType,
                                           @RequestParam(name = "batchSize", required = false) Integer batchSize) {
        if (batchSize == null) {
            return batchJobQueue.processBatchJobs(jobType);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return batchJobQueue.processBatchJobs(jobType, batchSize);
    }
}
