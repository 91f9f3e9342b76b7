package com.scholary.channel.insights.youtube;

import java.util.List;

/**
 * One page of {@code search.list} results.
 *
 * @param hits matches on this page, in provider order
 * @param nextPageToken token for the following page, or null on the last page
 */
public record SearchPage(List<Hit> hits, String nextPageToken) {

  public SearchPage {
    hits = hits == null ? List.of() : List.copyOf(hits);
  }

  /** A single search match; {@code channelId} may be null when the snippet is missing. */
  public record Hit(String videoId, String channelId) {}
}
