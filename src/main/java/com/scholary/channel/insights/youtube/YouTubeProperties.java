package com.scholary.channel.insights.youtube;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the YouTube REST client.
 *
 * <p>Base URLs are configurable so tests (or a mock) can stand in for Google's endpoints.
 * Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "youtube")
@Validated
public record YouTubeProperties(
    @NotBlank String dataBaseUrl,
    @NotBlank String analyticsBaseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
