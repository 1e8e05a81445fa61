package com.polytape.livefeed.ws;

import com.polytape.config.FeedProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Watches the open session: forces a reconnect when the stream goes quiet and recycles the socket periodically.
 */
@Slf4j
@RequiredArgsConstructor
public class HealthMonitor {

  private final @NonNull FeedConnection connection;
  private final @NonNull FeedProperties.Health config;
  private final @NonNull Clock clock;

  /**
   * @return true when a stale socket was force-closed
   */
  public boolean checkStaleness() {
    FeedSession session = connection.session();
    if (!session.isOpen()) {
      return false;
    }
    Duration idle = idleFor(session, clock.instant());
    if (idle.toMillis() <= config.staleTimeoutMillis()) {
      return false;
    }
    log.warn("no live feed frame for {}ms, forcing reconnect", idle.toMillis());
    connection.forceReconnect(FeedCloseCodes.STALE, "stale");
    return true;
  }

  /**
   * @return true when the open socket was recycled
   */
  public boolean hardReconnect() {
    if (!connection.session().isOpen()) {
      return false;
    }
    log.info("periodic live feed reconnect");
    connection.forceReconnect(FeedCloseCodes.HARD_RECONNECT, "periodic");
    return true;
  }

  public FeedHealth health() {
    FeedSession session = connection.session();
    if (!session.isOpen()) {
      return FeedHealth.OFFLINE;
    }
    return idleFor(session, clock.instant()).toMillis() > config.staleWarnMillis() ? FeedHealth.STALE : FeedHealth.LIVE;
  }

  public double eventsPerMinute() {
    return connection.session().throughput().eventsPerMinute(clock.instant());
  }

  public Duration lastMessageAge() {
    FeedSession session = connection.session();
    Instant last = session.lastActivityAt();
    return last == null ? null : Duration.between(last, clock.instant());
  }

  private static Duration idleFor(FeedSession session, Instant now) {
    Instant last = session.lastActivityAt();
    return last == null ? Duration.ZERO : Duration.between(last, now);
  }
}
