package com.scholary.channel.insights.quota;

/**
 * Unit cost charged by the YouTube APIs per call.
 *
 * <p>Video details are charged per part requested, so callers multiply {@link
 * #VIDEOS_LIST_PER_PART} by the number of parts.
 */
public final class QuotaCost {

  public static final long SEARCH_LIST = 100;
  public static final long CHANNELS_LIST = 1;
  public static final long PLAYLIST_ITEMS_LIST = 2;
  public static final long VIDEOS_LIST_PER_PART = 2;
  public static final long ANALYTICS_REPORTS_QUERY = 1;

  public static final String ACTION_SEARCH = "youtube.search.list";
  public static final String ACTION_CHANNELS = "youtube.channels.list";
  public static final String ACTION_PLAYLIST_ITEMS = "youtube.playlistItems.list";
  public static final String ACTION_VIDEOS = "youtube.videos.list";
  public static final String ACTION_ANALYTICS = "youtubeAnalytics.reports.query";

  private QuotaCost() {}
}
