package com.scholary.channel.insights.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for a report by video length.
 *
 * <p>{@code ownChannel} defaults to true; set it to false to count only public videos.
 */
public record DurationAnalysisRequest(
    @NotBlank String accessToken,
    @NotBlank String channelId,
    @NotEmpty List<@Valid DateRangeRequest> dateRanges,
    Boolean ownChannel) {

  public DurationAnalysisRequest {
    if (ownChannel == null) {
      ownChannel = true;
    }
  }
}
