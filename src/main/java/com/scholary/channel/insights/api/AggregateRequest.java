package com.scholary.channel.insights.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for a keyword x date-range report.
 *
 * <p>The access token is the caller's OAuth token for YouTube; it is used for this job only and
 * never stored.
 */
public record AggregateRequest(
    @NotBlank String accessToken,
    @NotBlank String channelId,
    @NotEmpty List<@Valid KeywordGroupRequest> keywordGroups,
    @NotEmpty List<@Valid DateRangeRequest> dateRanges) {}
