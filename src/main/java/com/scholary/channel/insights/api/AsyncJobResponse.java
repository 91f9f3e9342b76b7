package com.scholary.channel.insights.api;

/**
 * Response for an async analytics request.
 *
 * <p>Returns a job ID that can be used to poll {@code /api/jobs/{id}} for status.
 */
public record AsyncJobResponse(String jobId) {}
