package com.scholary.channel.insights.youtube;

import java.util.List;

/** One page of {@code playlistItems.list}: the video ids plus the token for the next page. */
public record PlaylistPage(List<String> videoIds, String nextPageToken) {

  public PlaylistPage {
    videoIds = videoIds == null ? List.of() : List.copyOf(videoIds);
  }
}
