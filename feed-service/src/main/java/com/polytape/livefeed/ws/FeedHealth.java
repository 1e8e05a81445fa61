package com.polytape.livefeed.ws;

public enum FeedHealth {
  LIVE,
  STALE,
  OFFLINE
}
