package com.scholary.channel.insights.analytics;

import java.util.List;

/**
 * Combines per-chunk metric sets into one.
 *
 * <p>Counts are summed. {@code averageViewDuration} and {@code averageViewPercentage} are combined
 * as {@code sum(views * metric) / sum(views)}, so a chunk with few views cannot skew the result;
 * with no views at all they are 0.
 */
public final class MetricsCombiner {

  private MetricsCombiner() {}

  /**
   * Combine chunk results.
   *
   * @param chunks metric sets of the chunks that returned data
   * @return the combined metrics; {@link MetricSet#zero()} when {@code chunks} is empty
   */
  public static MetricSet combine(List<MetricSet> chunks) {
    if (chunks.isEmpty()) {
      return MetricSet.zero();
    }
    if (chunks.size() == 1) {
      return chunks.get(0);
    }

    long views = 0;
    double minutes = 0;
    long likes = 0;
    long comments = 0;
    long shares = 0;
    long subscribers = 0;
    double weightedDuration = 0;
    double weightedPercentage = 0;

    for (MetricSet chunk : chunks) {
      views += chunk.views();
      minutes += chunk.estimatedMinutesWatched();
      likes += chunk.likes();
      comments += chunk.comments();
      shares += chunk.shares();
      subscribers += chunk.subscribersGained();
      weightedDuration += chunk.views() * chunk.averageViewDuration();
      weightedPercentage += chunk.views() * chunk.averageViewPercentage();
    }

    return new MetricSet(
        views,
        minutes,
        views > 0 ? weightedDuration / views : 0,
        views > 0 ? weightedPercentage / views : 0,
        likes,
        comments,
        shares,
        subscribers);
  }
}
