package com.scholary.channel.insights.api;

import com.scholary.channel.insights.analytics.KeywordGroup;
import jakarta.validation.constraints.NotBlank;

/** A report row. An empty keyword selects every video of the channel. */
public record KeywordGroupRequest(@NotBlank String name, String keyword) {

  KeywordGroup toKeywordGroup() {
    return new KeywordGroup(name, keyword);
  }
}
