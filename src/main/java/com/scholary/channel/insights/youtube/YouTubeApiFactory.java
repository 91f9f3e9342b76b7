package com.scholary.channel.insights.youtube;

/** Creates {@link YouTubeApi} handles bound to an OAuth access token. */
public interface YouTubeApiFactory {

  YouTubeApi forAccessToken(String accessToken);
}
