package com.scholary.channel.insights.youtube;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Builds {@link HttpYouTubeApi} handles that share one {@link HttpClient}. */
@Component
public class HttpYouTubeApiFactory implements YouTubeApiFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpYouTubeApiFactory.class);

  private final HttpClient httpClient;
  private final YouTubeProperties properties;
  private final ObjectMapper objectMapper;

  public HttpYouTubeApiFactory(YouTubeProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized YouTube client: dataBaseUrl={}, analyticsBaseUrl={}",
        properties.dataBaseUrl(),
        properties.analyticsBaseUrl());
  }

  @Override
  public YouTubeApi forAccessToken(String accessToken) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken is required");
    }
    return new HttpYouTubeApi(httpClient, properties, objectMapper, accessToken);
  }
}
