package com.scholary.channel.insights.analytics;

/**
 * A named keyword filter; one report row.
 *
 * @param name row label
 * @param keyword filter; null or blank selects every video
 */
public record KeywordGroup(String name, String keyword) {

  public KeywordGroup {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Keyword group name is required");
    }
    keyword = keyword == null ? "" : keyword.trim();
  }
}
