package com.scholary.channel.insights.discovery;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses the {@code PT#H#M#S} durations the provider reports for videos. */
public final class Iso8601Durations {

  private static final Pattern DURATION =
      Pattern.compile("P(?:(\\d+)D)?T?(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?");

  private Iso8601Durations() {}

  /**
   * Convert a duration to whole seconds.
   *
   * @return the duration in seconds, or 0 if the value is missing or not a duration
   */
  public static long toSeconds(String duration) {
    if (duration == null || duration.isBlank()) {
      return 0;
    }
    Matcher matcher = DURATION.matcher(duration.trim());
    if (!matcher.matches()) {
      return 0;
    }
    return group(matcher, 1) * 86_400
        + group(matcher, 2) * 3_600
        + group(matcher, 3) * 60
        + group(matcher, 4);
  }

  private static long group(Matcher matcher, int index) {
    String value = matcher.group(index);
    return value == null ? 0 : Long.parseLong(value);
  }
}
