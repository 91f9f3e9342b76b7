package com.scholary.channel.insights.analytics;

/** Video length buckets, lower bound inclusive and upper bound exclusive, in seconds. */
public enum DurationBucket {
  SHORTS("shorts", "0-1 min (Shorts)", 0, 60),
  SHORT("short", "1-5 min", 60, 300),
  MEDIUM("medium", "5-10 min", 300, 600),
  LONG("long", "10-20 min", 600, 1200),
  VERY_LONG("veryLong", "20+ min", 1200, Long.MAX_VALUE);

  private final String id;
  private final String label;
  private final long minSeconds;
  private final long maxSeconds;

  DurationBucket(String id, String label, long minSeconds, long maxSeconds) {
    this.id = id;
    this.label = label;
    this.minSeconds = minSeconds;
    this.maxSeconds = maxSeconds;
  }

  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  public boolean contains(long seconds) {
    return seconds >= minSeconds && seconds < maxSeconds;
  }

  /** The bucket holding {@code seconds}; negative values fall into {@link #SHORTS}. */
  public static DurationBucket of(long seconds) {
    for (DurationBucket bucket : values()) {
      if (bucket.contains(seconds)) {
        return bucket;
      }
    }
    return SHORTS;
  }
}
