package com.scholary.channel.insights.youtube;

/** Resource parts that can be requested from {@code videos.list}, each billed separately. */
public enum VideoPart {
  SNIPPET("snippet"),
  STATUS("status"),
  CONTENT_DETAILS("contentDetails");

  private final String apiName;

  VideoPart(String apiName) {
    this.apiName = apiName;
  }

  public String apiName() {
    return apiName;
  }
}
