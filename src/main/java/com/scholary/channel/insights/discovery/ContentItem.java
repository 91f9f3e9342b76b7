package com.scholary.channel.insights.discovery;

import com.scholary.channel.insights.youtube.VideoDetails;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * One discovered video.
 *
 * @param itemId provider video id
 * @param title title, empty if unknown
 * @param description description, empty if unknown
 * @param tags creator tags
 * @param publishedAt publish time, null if unknown
 * @param visibility public, unlisted or private
 * @param thumbnailUrl medium thumbnail, empty if unknown
 * @param durationSeconds length in seconds; 0 unless content details were requested
 */
public record ContentItem(
    String itemId,
    String title,
    String description,
    Set<String> tags,
    Instant publishedAt,
    Visibility visibility,
    String thumbnailUrl,
    long durationSeconds) {

  public ContentItem {
    title = title == null ? "" : title;
    description = description == null ? "" : description;
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    thumbnailUrl = thumbnailUrl == null ? "" : thumbnailUrl;
  }

  static ContentItem from(VideoDetails details) {
    return new ContentItem(
        details.id(),
        details.title(),
        details.description(),
        Set.copyOf(details.tags()),
        details.publishedAt(),
        Visibility.fromPrivacyStatus(details.privacyStatus()),
        details.thumbnailUrl(),
        Iso8601Durations.toSeconds(details.duration()));
  }

  /** Case-insensitive substring match across title, description and tags. */
  public boolean matches(String keyword) {
    if (keyword == null || keyword.isBlank()) {
      return true;
    }
    String needle = keyword.trim().toLowerCase(Locale.ROOT);
    if (title.toLowerCase(Locale.ROOT).contains(needle)
        || description.toLowerCase(Locale.ROOT).contains(needle)) {
      return true;
    }
    return tags.stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(needle));
  }
}
