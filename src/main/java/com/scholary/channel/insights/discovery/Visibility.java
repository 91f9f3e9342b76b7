package com.scholary.channel.insights.discovery;

import java.util.Locale;

/** Who can see a video. */
public enum Visibility {
  PUBLIC,
  UNLISTED,
  PRIVATE;

  /** Map the provider's {@code privacyStatus}; a missing status counts as public. */
  public static Visibility fromPrivacyStatus(String privacyStatus) {
    if (privacyStatus == null || privacyStatus.isBlank()) {
      return PUBLIC;
    }
    return switch (privacyStatus.toLowerCase(Locale.ROOT)) {
      case "private" -> PRIVATE;
      case "unlisted" -> UNLISTED;
      default -> PUBLIC;
    };
  }
}
