package com.glimpse.messaging.api.dto;

import java.util.Map;

public record QueueStats(int offlineQueues,
                         int pushRetryQueueSize,
                         long delayedJobsSize,
                         Map<String, Long> batchJobQueues) {
}
