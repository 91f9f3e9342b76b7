package com.scholary.channel.insights.youtube;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the client against a local HTTP server that plays back canned YouTube answers. */
class HttpYouTubeApiTest {

  private HttpServer server;
  private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
  private final Map<String, String> bodies = new ConcurrentHashMap<>();
  private final List<String> requestUris = new CopyOnWriteArrayList<>();
  private final List<String> authHeaders = new CopyOnWriteArrayList<>();
  private final AtomicInteger requestCount = new AtomicInteger();

  private HttpYouTubeApi api;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          requestCount.incrementAndGet();
          requestUris.add(exchange.getRequestURI().toString());
          authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
          String path = exchange.getRequestURI().getPath();
          byte[] body = bodies.getOrDefault(path, "{}").getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(statuses.getOrDefault(path, 200), body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();

    String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    YouTubeProperties properties =
        new YouTubeProperties(baseUrl + "/youtube/v3", baseUrl + "/v2", 5, 5, 1);
    api = new HttpYouTubeApi(HttpClient.newHttpClient(), properties, new ObjectMapper(), "token-1");
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void searchOwnVideos_shouldParseHitsAndSendBearerToken() {
    bodies.put(
        "/youtube/v3/search",
        """
        {"nextPageToken": "P2",
         "items": [
           {"id": {"videoId": "v1"}, "snippet": {"channelId": "UC1"}},
           {"id": {"kind": "youtube#channel"}, "snippet": {"channelId": "UC1"}},
           {"id": {"videoId": "v2"}, "snippet": {"channelId": "UC9"}}
         ]}
        """);

    SearchPage page = api.searchOwnVideos("bread", 50, null);

    assertThat(page.hits())
        .containsExactly(new SearchPage.Hit("v1", "UC1"), new SearchPage.Hit("v2", "UC9"));
    assertThat(page.nextPageToken()).isEqualTo("P2");
    assertThat(authHeaders).containsExactly("Bearer token-1");
    assertThat(requestUris.get(0)).contains("forMine=true").contains("q=bread");
    assertThat(requestUris.get(0)).doesNotContain("pageToken");
  }

  @Test
  void findUploadsPlaylistId_shouldReadRelatedPlaylist() {
    bodies.put(
        "/youtube/v3/channels",
        """
        {"items": [{"contentDetails": {"relatedPlaylists": {"uploads": "UU1"}}}]}
        """);

    assertThat(api.findUploadsPlaylistId("UC1")).isEqualTo("UU1");
  }

  @Test
  void findUploadsPlaylistId_shouldFailForUnknownChannel() {
    bodies.put("/youtube/v3/channels", "{\"items\": []}");

    assertThatThrownBy(() -> api.findUploadsPlaylistId("UCX"))
        .isInstanceOf(YouTubeApiException.class)
        .hasMessageContaining("Channel not found");
  }

  @Test
  void getVideoDetails_shouldParseSnippetStatusAndDuration() {
    bodies.put(
        "/youtube/v3/videos",
        """
        {"items": [{
          "id": "v1",
          "snippet": {
            "title": "Sourdough basics",
            "description": "How to bake",
            "tags": ["bread", "baking"],
            "publishedAt": "2024-03-01T10:00:00Z",
            "thumbnails": {"medium": {"url": "https://img/v1.jpg"}}
          },
          "status": {"privacyStatus": "unlisted"},
          "contentDetails": {"duration": "PT4M13S"}
        }]}
        """);

    List<VideoDetails> videos =
        api.getVideoDetails(
            List.of("v1"),
            EnumSet.of(VideoPart.SNIPPET, VideoPart.STATUS, VideoPart.CONTENT_DETAILS));

    assertThat(videos).hasSize(1);
    VideoDetails video = videos.get(0);
    assertThat(video.title()).isEqualTo("Sourdough basics");
    assertThat(video.tags()).containsExactly("bread", "baking");
    assertThat(video.publishedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    assertThat(video.thumbnailUrl()).isEqualTo("https://img/v1.jpg");
    assertThat(video.privacyStatus()).isEqualTo("unlisted");
    assertThat(video.duration()).isEqualTo("PT4M13S");
  }

  @Test
  void getVideoDetails_shouldSkipCallForNoIds() {
    assertThat(api.getVideoDetails(List.of(), EnumSet.of(VideoPart.SNIPPET))).isEmpty();
    assertThat(requestCount.get()).isZero();
  }

  @Test
  void queryVideoMetrics_shouldSendChannelAndVideoFilter() {
    bodies.put(
        "/v2/reports",
        """
        {"columnHeaders": [{"name": "views"}, {"name": "averageViewPercentage"}],
         "rows": [[1200, 41.5]]}
        """);

    AnalyticsReport report =
        api.queryVideoMetrics(
            "UC1",
            List.of("v1", "v2"),
            List.of("views", "averageViewPercentage"),
            LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 1, 31));

    assertThat(report.columns()).containsExactly("views", "averageViewPercentage");
    assertThat(report.rows()).containsExactly(List.of(1200.0, 41.5));
    assertThat(requestUris.get(0))
        .contains("ids=channel%3D%3DUC1")
        .contains("filters=video%3D%3Dv1%2Cv2")
        .contains("startDate=2024-01-01");
  }

  @Test
  void queryVideoMetrics_shouldReturnEmptyReportWithoutRows() {
    bodies.put("/v2/reports", "{\"columnHeaders\": [{\"name\": \"views\"}]}");

    AnalyticsReport report =
        api.queryVideoMetrics(
            "UC1",
            List.of("v1"),
            List.of("views"),
            LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 1, 2));

    assertThat(report.isEmpty()).isTrue();
  }

  @Test
  void get_shouldRaiseQuotaExceededForQuotaReason() {
    statuses.put("/v2/reports", 403);
    bodies.put(
        "/v2/reports",
        """
        {"error": {"code": 403, "message": "Quota exceeded for quota metric",
                   "errors": [{"reason": "quotaExceeded"}]}}
        """);

    assertThatThrownBy(
            () ->
                api.queryVideoMetrics(
                    "UC1",
                    List.of("v1"),
                    List.of("views"),
                    LocalDate.of(2024, 1, 1),
                    LocalDate.of(2024, 1, 2)))
        .isInstanceOf(QuotaExceededException.class)
        .hasMessageContaining("Quota exceeded");
  }

  @Test
  void get_shouldRaiseQuotaExceededForTooManyRequests() {
    statuses.put("/youtube/v3/search", 429);

    assertThatThrownBy(() -> api.searchOwnVideos("bread", 50, null))
        .isInstanceOf(QuotaExceededException.class);
  }

  @Test
  void get_shouldRaisePlainErrorForOtherClientErrors() {
    statuses.put("/youtube/v3/channels", 403);
    bodies.put(
        "/youtube/v3/channels",
        """
        {"error": {"code": 403, "message": "Forbidden", "errors": [{"reason": "forbidden"}]}}
        """);

    assertThatThrownBy(() -> api.getChannelCountry("UC1"))
        .isInstanceOf(YouTubeApiException.class)
        .isNotInstanceOf(QuotaExceededException.class)
        .satisfies(e -> assertThat(((YouTubeApiException) e).status()).isEqualTo(403));
    assertThat(requestCount.get()).isEqualTo(1);
  }

  @Test
  void get_shouldGiveUpAfterServerErrors() {
    statuses.put("/youtube/v3/channels", 503);

    assertThatThrownBy(() -> api.getChannelCountry("UC1"))
        .isInstanceOf(YouTubeApiException.class)
        .hasMessageContaining("failed after 1 attempts");
  }

  @Test
  void getChannelCountry_shouldBeEmptyWhenCountryMissing() {
    bodies.put("/youtube/v3/channels", "{\"items\": [{\"snippet\": {\"title\": \"Bakes\"}}]}");

    assertThat(api.getChannelCountry("UC1")).isEmpty();
  }
}
