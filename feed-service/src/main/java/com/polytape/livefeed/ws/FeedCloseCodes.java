package com.polytape.livefeed.ws;

/**
 * Close codes used by the feed. 4000-4999 is the application range of RFC 6455.
 */
public final class FeedCloseCodes {

  public static final int NORMAL = 1000;
  public static final int STALE = 4000;
  public static final int HARD_RECONNECT = 4001;
  public static final int MANUAL = 4002;

  private FeedCloseCodes() {
  }

  public static String reasonTag(int code) {
    return switch (code) {
      case STALE -> "stale";
      case HARD_RECONNECT -> "periodic";
      case MANUAL -> "manual";
      case NORMAL -> "normal";
      default -> "abnormal";
    };
  }
}
