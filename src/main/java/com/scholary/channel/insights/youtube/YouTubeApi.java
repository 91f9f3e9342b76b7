package com.scholary.channel.insights.youtube;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The YouTube Data v3 and Analytics v2 calls the service relies on, bound to one caller's access
 * token.
 *
 * <p>Implementations only talk to the provider. Quota accounting is done by the callers, which
 * know why each call is made.
 *
 * @throws QuotaExceededException from any method when the provider reports quota exhaustion
 * @throws YouTubeApiException from any method for other provider or transport failures
 */
public interface YouTubeApi {

  /** Search the authenticated owner's videos, newest first. */
  SearchPage searchOwnVideos(String keyword, int maxResults, String pageToken);

  /**
   * Look up the playlist holding every upload of a channel.
   *
   * @throws YouTubeApiException if the channel does not exist
   */
  String findUploadsPlaylistId(String channelId);

  PlaylistPage listPlaylistItems(String playlistId, int maxResults, String pageToken);

  /**
   * Fetch details for up to 50 videos in one call. Videos that are deleted or not visible to the
   * caller are missing from the result.
   */
  List<VideoDetails> getVideoDetails(Collection<String> videoIds, Set<VideoPart> parts);

  /** The country set on the channel, if any. */
  Optional<String> getChannelCountry(String channelId);

  /** Run one analytics query over the given videos, summed over the date range. */
  AnalyticsReport queryVideoMetrics(
      String channelId,
      Collection<String> videoIds,
      List<String> metrics,
      LocalDate startDate,
      LocalDate endDate);
}
