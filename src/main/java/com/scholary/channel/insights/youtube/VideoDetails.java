package com.scholary.channel.insights.youtube;

import java.time.Instant;
import java.util.List;

/**
 * Video resource as returned by {@code videos.list}.
 *
 * <p>Only the parts that were requested are populated; the rest are null.
 */
public record VideoDetails(
    String id,
    String title,
    String description,
    List<String> tags,
    Instant publishedAt,
    String thumbnailUrl,
    String privacyStatus,
    String duration) {

  public VideoDetails {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
