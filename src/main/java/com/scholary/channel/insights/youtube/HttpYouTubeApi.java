package com.scholary.channel.insights.youtube;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the YouTube Data v3 and Analytics v2 REST endpoints.
 *
 * <p>Every request is a GET authorized with the caller's bearer token. Transport failures and 5xx
 * answers are retried with exponential backoff; 4xx answers are not. Quota and rate-limit answers
 * become {@link QuotaExceededException} so callers can tell them apart.
 */
public class HttpYouTubeApi implements YouTubeApi {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpYouTubeApi.class);

  private static final Set<String> QUOTA_REASONS =
      Set.of("quotaExceeded", "rateLimitExceeded", "dailyLimitExceeded", "userRateLimitExceeded");

  private final HttpClient httpClient;
  private final YouTubeProperties properties;
  private final ObjectMapper objectMapper;
  private final String accessToken;

  HttpYouTubeApi(
      HttpClient httpClient,
      YouTubeProperties properties,
      ObjectMapper objectMapper,
      String accessToken) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.accessToken = accessToken;
  }

  @Override
  public SearchPage searchOwnVideos(String keyword, int maxResults, String pageToken) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("part", "id,snippet");
    params.put("forMine", "true");
    params.put("type", "video");
    params.put("maxResults", String.valueOf(maxResults));
    params.put("order", "date");
    params.put("q", keyword);
    params.put("pageToken", pageToken);

    JsonNode body = get(properties.dataBaseUrl(), "/search", params);
    List<SearchPage.Hit> hits = new ArrayList<>();
    for (JsonNode item : body.path("items")) {
      String videoId = textOrNull(item.path("id").path("videoId"));
      if (videoId != null) {
        hits.add(new SearchPage.Hit(videoId, textOrNull(item.path("snippet").path("channelId"))));
      }
    }
    return new SearchPage(hits, textOrNull(body.path("nextPageToken")));
  }

  @Override
  public String findUploadsPlaylistId(String channelId) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("part", "contentDetails");
    params.put("id", channelId);

    JsonNode items = get(properties.dataBaseUrl(), "/channels", params).path("items");
    String playlistId =
        items.isEmpty()
            ? null
            : textOrNull(
                items.get(0).path("contentDetails").path("relatedPlaylists").path("uploads"));
    if (playlistId == null) {
      throw new YouTubeApiException(404, "Channel not found: " + channelId);
    }
    return playlistId;
  }

  @Override
  public PlaylistPage listPlaylistItems(String playlistId, int maxResults, String pageToken) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("part", "snippet");
    params.put("playlistId", playlistId);
    params.put("maxResults", String.valueOf(maxResults));
    params.put("pageToken", pageToken);

    JsonNode body = get(properties.dataBaseUrl(), "/playlistItems", params);
    List<String> videoIds = new ArrayList<>();
    for (JsonNode item : body.path("items")) {
      String videoId = textOrNull(item.path("snippet").path("resourceId").path("videoId"));
      if (videoId != null) {
        videoIds.add(videoId);
      }
    }
    return new PlaylistPage(videoIds, textOrNull(body.path("nextPageToken")));
  }

  @Override
  public List<VideoDetails> getVideoDetails(Collection<String> videoIds, Set<VideoPart> parts) {
    if (videoIds.isEmpty()) {
      return List.of();
    }
    Map<String, String> params = new LinkedHashMap<>();
    params.put(
        "part", parts.stream().map(VideoPart::apiName).sorted().collect(Collectors.joining(",")));
    params.put("id", String.join(",", videoIds));

    JsonNode body = get(properties.dataBaseUrl(), "/videos", params);
    List<VideoDetails> videos = new ArrayList<>();
    for (JsonNode item : body.path("items")) {
      videos.add(toVideoDetails(item));
    }
    return videos;
  }

  @Override
  public Optional<String> getChannelCountry(String channelId) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("part", "snippet");
    params.put("id", channelId);

    JsonNode items = get(properties.dataBaseUrl(), "/channels", params).path("items");
    if (items.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(textOrNull(items.get(0).path("snippet").path("country")));
  }

  @Override
  public AnalyticsReport queryVideoMetrics(
      String channelId,
      Collection<String> videoIds,
      List<String> metrics,
      LocalDate startDate,
      LocalDate endDate) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("ids", "channel==" + channelId);
    params.put("startDate", startDate.toString());
    params.put("endDate", endDate.toString());
    params.put("metrics", String.join(",", metrics));
    params.put("filters", "video==" + String.join(",", videoIds));

    JsonNode body = get(properties.analyticsBaseUrl(), "/reports", params);
    List<String> columns = new ArrayList<>();
    for (JsonNode header : body.path("columnHeaders")) {
      columns.add(header.path("name").asText());
    }
    if (columns.isEmpty()) {
      columns.addAll(metrics);
    }
    List<List<Double>> rows = new ArrayList<>();
    for (JsonNode row : body.path("rows")) {
      List<Double> values = new ArrayList<>();
      for (JsonNode value : row) {
        values.add(value.asDouble(0));
      }
      rows.add(values);
    }
    return new AnalyticsReport(columns, rows);
  }

  /**
   * Perform a GET with retries.
   *
   * @throws YouTubeApiException if the call fails after retries or is refused by the provider
   */
  private JsonNode get(String baseUrl, String path, Map<String, String> params) {
    URI uri = URI.create(baseUrl + path + "?" + encode(params));

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptGet(uri);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "YouTube call {} attempt {} failed, retrying in {}ms: {}",
              path,
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new YouTubeApiException("YouTube call interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new YouTubeApiException("YouTube call interrupted", e);
      }
    }

    throw new YouTubeApiException(
        String.format("YouTube call %s failed after %d attempts", path, properties.maxRetries()),
        lastException);
  }

  private JsonNode attemptGet(URI uri) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + accessToken)
            .header("Accept", "application/json")
            .GET()
            .build();

    LOGGER.debug("Sending YouTube request to {}", uri.getPath());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();

    if (status >= 500) {
      throw new IOException(
          String.format("YouTube API returned status %d: %s", status, response.body()));
    }
    if (status != 200) {
      throw toException(status, response.body());
    }
    return objectMapper.readTree(response.body());
  }

  /** Map an error answer to the exception type callers distinguish. */
  private YouTubeApiException toException(int status, String body) {
    String message = "YouTube API returned status " + status;
    boolean quotaReason = false;
    try {
      JsonNode error = objectMapper.readTree(body).path("error");
      if (error.hasNonNull("message")) {
        message = error.get("message").asText();
      }
      for (JsonNode detail : error.path("errors")) {
        if (QUOTA_REASONS.contains(detail.path("reason").asText())) {
          quotaReason = true;
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Error body is not JSON: {}", body);
    }

    if (status == 429 || (status == 403 && quotaReason)) {
      return new QuotaExceededException(status, message);
    }
    return new YouTubeApiException(status, message);
  }

  private static VideoDetails toVideoDetails(JsonNode item) {
    JsonNode snippet = item.path("snippet");
    List<String> tags = new ArrayList<>();
    for (JsonNode tag : snippet.path("tags")) {
      tags.add(tag.asText());
    }
    return new VideoDetails(
        textOrNull(item.path("id")),
        textOrNull(snippet.path("title")),
        textOrNull(snippet.path("description")),
        tags,
        parseInstant(textOrNull(snippet.path("publishedAt"))),
        textOrNull(snippet.path("thumbnails").path("medium").path("url")),
        textOrNull(item.path("status").path("privacyStatus")),
        textOrNull(item.path("contentDetails").path("duration")));
  }

  private static Instant parseInstant(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      LOGGER.debug("Unparseable publishedAt: {}", value);
      return null;
    }
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
  }

  private static String encode(Map<String, String> params) {
    return params.entrySet().stream()
        .filter(e -> e.getValue() != null)
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}
