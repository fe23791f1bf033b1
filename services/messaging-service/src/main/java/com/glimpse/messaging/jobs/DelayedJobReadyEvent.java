package com.glimpse.messaging.jobs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Published when a delayed job comes due. Listeners pick their jobs by {@code jobType}, e.g.
 * {@code @EventListener(condition = "#event.jobType == 'digest'")}.
 */
public record DelayedJobReadyEvent(String jobId, String jobType, JsonNode payload) {
}
