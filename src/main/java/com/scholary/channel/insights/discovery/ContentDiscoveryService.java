package com.scholary.channel.insights.discovery;

import com.scholary.channel.insights.config.AnalyticsProperties;
import com.scholary.channel.insights.logging.StructuredLogger;
import com.scholary.channel.insights.quota.QuotaCost;
import com.scholary.channel.insights.quota.QuotaLedger;
import com.scholary.channel.insights.youtube.PlaylistPage;
import com.scholary.channel.insights.youtube.SearchPage;
import com.scholary.channel.insights.youtube.VideoDetails;
import com.scholary.channel.insights.youtube.VideoPart;
import com.scholary.channel.insights.youtube.YouTubeApi;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the videos of a channel that match a keyword.
 *
 * <p>A keyword is first sent to the search endpoint, which is precise but costs 100 units per
 * page. If search finds nothing, or fails for any reason, the service walks the channel's uploads
 * playlist page by page (a few units per page) and applies the keyword locally. Without a keyword
 * it enumerates straight away.
 *
 * <p>Both paths stop at {@code analytics.maxItems}; enumeration also stops at {@code
 * analytics.maxEnumerationPages}. Every provider call is recorded in the {@link QuotaLedger}.
 */
@Service
public class ContentDiscoveryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentDiscoveryService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final Set<VideoPart> LISTING_PARTS = EnumSet.of(VideoPart.SNIPPET, VideoPart.STATUS);
  private static final int PLAYLIST_PAGE_SIZE = 50;

  private final QuotaLedger quotaLedger;
  private final AnalyticsProperties properties;

  public ContentDiscoveryService(QuotaLedger quotaLedger, AnalyticsProperties properties) {
    this.quotaLedger = quotaLedger;
    this.properties = properties;
  }

  /**
   * Find the channel's videos matching {@code keyword}.
   *
   * @param api provider handle for the caller
   * @param channelId channel to search
   * @param keyword filter; null or blank means every video
   * @return matching videos without duplicates, in discovery order
   * @throws com.scholary.channel.insights.youtube.YouTubeApiException if enumeration fails
   */
  public List<ContentItem> discover(YouTubeApi api, String channelId, String keyword) {
    String normalized = keyword == null ? "" : keyword.trim();

    if (!normalized.isEmpty()) {
      try {
        List<ContentItem> found = search(api, channelId, normalized);
        if (!found.isEmpty()) {
          LOGGER.info(
              "Search found {} videos for \"{}\" on channel {}",
              found.size(),
              normalized,
              channelId);
          return found;
        }
        structuredLogger.logDiscoveryFallback(channelId, normalized, "search returned no videos");
      } catch (RuntimeException e) {
        structuredLogger.logDiscoveryFallback(channelId, normalized, e.getMessage());
      }
    }

    List<ContentItem> all = listAll(api, channelId, LISTING_PARTS);
    if (normalized.isEmpty()) {
      return all;
    }
    List<ContentItem> filtered =
        all.stream().filter(item -> item.matches(normalized)).collect(Collectors.toList());
    LOGGER.info(
        "Keyword \"{}\" matched {} of {} videos on channel {}",
        normalized,
        filtered.size(),
        all.size(),
        channelId);
    return filtered;
  }

  /**
   * Enumerate every upload of the channel, including unlisted and private videos the caller can
   * see.
   *
   * @param parts video parts to fetch for each page; each part is billed
   */
  public List<ContentItem> listAll(YouTubeApi api, String channelId, Set<VideoPart> parts) {
    String playlistId = api.findUploadsPlaylistId(channelId);
    quotaLedger.record(
        QuotaCost.ACTION_CHANNELS,
        QuotaCost.CHANNELS_LIST,
        Map.of("part", "contentDetails", "context", "discovery:enumerate"));

    Map<String, ContentItem> items = new LinkedHashMap<>();
    String pageToken = null;
    int pages = 0;

    do {
      PlaylistPage page = api.listPlaylistItems(playlistId, PLAYLIST_PAGE_SIZE, pageToken);
      pages++;
      quotaLedger.record(
          QuotaCost.ACTION_PLAYLIST_ITEMS,
          QuotaCost.PLAYLIST_ITEMS_LIST,
          Map.of("page", pages, "context", "discovery:enumerate"));

      if (page.videoIds().isEmpty()) {
        break;
      }

      Map<String, VideoDetails> details = fetchDetails(api, page.videoIds(), parts);
      int skipped = 0;
      for (String videoId : page.videoIds()) {
        VideoDetails video = details.get(videoId);
        if (video == null) {
          skipped++;
          continue;
        }
        items.putIfAbsent(videoId, ContentItem.from(video));
      }
      if (skipped > 0) {
        LOGGER.info(
            "Skipped {} videos whose details could not be read (deleted or restricted)", skipped);
      }

      pageToken = page.nextPageToken();

      if (items.size() >= properties.maxItems()) {
        LOGGER.info("Reached item limit ({}) for channel {}", properties.maxItems(), channelId);
        break;
      }
      if (pageToken != null && pages >= properties.maxEnumerationPages()) {
        structuredLogger.logPageCeilingReached(channelId, pages, items.size());
        break;
      }
    } while (pageToken != null);

    LOGGER.info(
        "Enumerated {} videos over {} pages for channel {}", items.size(), pages, channelId);
    return limit(items);
  }

  private List<ContentItem> search(YouTubeApi api, String channelId, String keyword) {
    Map<String, ContentItem> items = new LinkedHashMap<>();
    String pageToken = null;
    int pages = 0;

    do {
      SearchPage page = api.searchOwnVideos(keyword, properties.searchPageSize(), pageToken);
      pages++;
      quotaLedger.record(
          QuotaCost.ACTION_SEARCH,
          QuotaCost.SEARCH_LIST,
          Map.of("keyword", keyword, "page", pages, "context", "discovery:search"));

      if (page.hits().isEmpty()) {
        break;
      }

      List<String> videoIds = new ArrayList<>();
      for (SearchPage.Hit hit : page.hits()) {
        if (items.containsKey(hit.videoId()) || videoIds.contains(hit.videoId())) {
          continue;
        }
        if (hit.channelId() != null && !hit.channelId().equals(channelId)) {
          continue;
        }
        videoIds.add(hit.videoId());
      }

      if (!videoIds.isEmpty()) {
        Map<String, VideoDetails> details = fetchDetails(api, videoIds, LISTING_PARTS);
        for (String videoId : videoIds) {
          VideoDetails video = details.get(videoId);
          if (video != null) {
            items.putIfAbsent(videoId, ContentItem.from(video));
          }
        }
        if (items.size() >= properties.maxItems()) {
          LOGGER.info("Search reached item limit ({})", properties.maxItems());
          break;
        }
      }

      pageToken = page.nextPageToken();
    } while (pageToken != null);

    return limit(items);
  }

  private Map<String, VideoDetails> fetchDetails(
      YouTubeApi api, List<String> videoIds, Set<VideoPart> parts) {
    List<VideoDetails> details = api.getVideoDetails(videoIds, parts);
    quotaLedger.record(
        QuotaCost.ACTION_VIDEOS,
        QuotaCost.VIDEOS_LIST_PER_PART * parts.size(),
        Map.of("parts", parts.size(), "videos", videoIds.size()));
    return details.stream()
        .filter(video -> video.id() != null)
        .collect(
            Collectors.toMap(
                VideoDetails::id,
                Function.identity(),
                (first, second) -> first,
                LinkedHashMap::new));
  }

  private List<ContentItem> limit(Map<String, ContentItem> items) {
    return items.values().stream().limit(properties.maxItems()).collect(Collectors.toList());
  }
}
