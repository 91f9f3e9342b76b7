package com.scholary.channel.insights.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for background jobs.
 *
 * <p>Controls how long finished jobs stay queryable and how many jobs may run at once.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobProperties(
    @Positive int retentionMinutes,
    @Positive int workerThreads,
    @Positive int queueCapacity,
    @Positive long sweepIntervalMs) {}
