package com.scholary.channel.insights.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits id lists into request-sized chunks.
 *
 * <p>The Analytics API accepts at most 200 ids in a {@code video==} filter, so larger sets are
 * queried chunk by chunk and combined afterwards.
 */
public final class IdChunker {

  public static final int MAX_ANALYTICS_FILTER_IDS = 200;

  private IdChunker() {}

  /**
   * Split {@code ids} into consecutive chunks of at most {@code size} elements.
   *
   * @param ids ids in the order they should be queried
   * @param size maximum chunk size
   * @return the chunks; empty if {@code ids} is empty
   */
  public static <T> List<List<T>> chunk(List<T> ids, int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    List<List<T>> chunks = new ArrayList<>((ids.size() + size - 1) / size);
    for (int from = 0; from < ids.size(); from += size) {
      chunks.add(List.copyOf(ids.subList(from, Math.min(from + size, ids.size()))));
    }
    return chunks;
  }
}
