package com.scholary.channel.insights.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.channel.insights.job.Job;
import com.scholary.channel.insights.job.JobStatus;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpJobStatusClientTest {

  private HttpServer server;
  private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
  private final Map<String, String> bodies = new ConcurrentHashMap<>();

  private HttpJobStatusClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/api/jobs/",
        exchange -> {
          String path = exchange.getRequestURI().getPath();
          byte[] body = bodies.getOrDefault(path, "").getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(
              statuses.getOrDefault(path, 404), body.length == 0 ? -1 : body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();

    client =
        new HttpJobStatusClient(
            "http://127.0.0.1:" + server.getAddress().getPort() + "/",
            new ObjectMapper().findAndRegisterModules(),
            Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void fetch_shouldParseJobStatus() {
    statuses.put("/api/jobs/job-1", 200);
    bodies.put(
        "/api/jobs/job-1",
        """
        {"id": "job-1", "kind": "channel-aggregate", "status": "processing",
         "progressPercent": 40, "progressMessage": "Querying Bread / May",
         "createdAt": "2024-07-01T10:00:00Z", "updatedAt": "2024-07-01T10:00:05Z",
         "extra": "ignored"}
        """);

    Optional<Job> job = client.fetch("job-1");

    assertThat(job).isPresent();
    assertThat(job.get().status()).isEqualTo(JobStatus.PROCESSING);
    assertThat(job.get().progressPercent()).isEqualTo(40);
    assertThat(job.get().progressMessage()).isEqualTo("Querying Bread / May");
    assertThat(job.get().createdAt()).isEqualTo(Instant.parse("2024-07-01T10:00:00Z"));
  }

  @Test
  void fetch_shouldReturnEmptyForUnknownJob() {
    assertThat(client.fetch("missing")).isEmpty();
  }

  @Test
  void fetch_shouldFailOnServerError() {
    statuses.put("/api/jobs/job-1", 500);
    bodies.put("/api/jobs/job-1", "{\"error\": \"boom\"}");

    assertThatThrownBy(() -> client.fetch("job-1"))
        .isInstanceOf(JobStatusClientException.class)
        .hasMessageContaining("500");
  }

  @Test
  void fetch_shouldFailOnUnreadableBody() {
    statuses.put("/api/jobs/job-1", 200);
    bodies.put("/api/jobs/job-1", "not json");

    assertThatThrownBy(() -> client.fetch("job-1"))
        .isInstanceOf(JobStatusClientException.class)
        .hasMessageContaining("Unreadable");
  }
}
