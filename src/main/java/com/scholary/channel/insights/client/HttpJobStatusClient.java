package com.scholary.channel.insights.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.channel.insights.job.Job;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads job status from a running service over {@code GET /api/jobs/{id}}.
 *
 * <p>A 404 is the normal answer for an unknown or purged job and maps to an empty result.
 */
public class HttpJobStatusClient implements JobStatusSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpJobStatusClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final Duration requestTimeout;

  public HttpJobStatusClient(String baseUrl, ObjectMapper objectMapper, Duration requestTimeout) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.objectMapper =
        objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.requestTimeout = requestTimeout;
    this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
  }

  @Override
  public Optional<Job> fetch(String jobId) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    baseUrl + "/api/jobs/" + URLEncoder.encode(jobId, StandardCharsets.UTF_8)))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new JobStatusClientException("Job status request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JobStatusClientException("Job status request interrupted", e);
    }

    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    if (response.statusCode() != 200) {
      throw new JobStatusClientException(
          String.format(
              "Job status endpoint returned status %d: %s",
              response.statusCode(), response.body()));
    }

    try {
      return Optional.of(objectMapper.readValue(response.body(), Job.class));
    } catch (IOException e) {
      LOGGER.warn("Unreadable job status for {}: {}", jobId, response.body());
      throw new JobStatusClientException("Unreadable job status response", e);
    }
  }
}
