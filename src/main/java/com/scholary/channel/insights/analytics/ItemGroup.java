package com.scholary.channel.insights.analytics;

import java.util.List;

/** A resolved report row: a label and the video ids that belong to it. */
public record ItemGroup(String name, String keyword, List<String> itemIds) {

  public ItemGroup {
    itemIds = List.copyOf(itemIds);
  }
}
