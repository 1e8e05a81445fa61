package com.polytape.livefeed.ws;

import java.net.URI;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection state of the order stream. Written by {@link FeedConnection} only, readable from any thread.
 */
public final class FeedSession {

  public enum State {
    IDLE,
    CONNECTING,
    OPEN,
    RECONNECTING,
    CLOSED,
    FAILED
  }

  private final ThroughputMeter throughput;
  private final AtomicLong reconnects = new AtomicLong();

  private volatile State state = State.IDLE;
  private volatile URI subscriptionUrl;
  private volatile FeedSocket socket;
  private volatile long generation;
  private volatile Instant openedAt;
  private volatile Instant lastMessageAt;
  private volatile ConnectFailure connectFailure;
  private volatile String subscriptionId;

  FeedSession(Instant now) {
    this.throughput = new ThroughputMeter(now);
  }

  public State state() {
    return state;
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  public URI subscriptionUrl() {
    return subscriptionUrl;
  }

  public long generation() {
    return generation;
  }

  public Instant openedAt() {
    return openedAt;
  }

  public Instant lastMessageAt() {
    return lastMessageAt;
  }

  /**
   * Last frame time, or the open time when nothing arrived since the socket opened.
   */
  public Instant lastActivityAt() {
    Instant last = lastMessageAt;
    return last != null ? last : openedAt;
  }

  public ConnectFailure connectFailure() {
    return connectFailure;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public ThroughputMeter throughput() {
    return throughput;
  }

  public long reconnects() {
    return reconnects.get();
  }

  FeedSocket socket() {
    return socket;
  }

  void cacheSubscriptionUrl(URI uri) {
    this.subscriptionUrl = uri;
  }

  void connecting(FeedSocket socket, long generation) {
    this.socket = socket;
    this.generation = generation;
    this.state = State.CONNECTING;
  }

  void opened(Instant now) {
    this.state = State.OPEN;
    this.openedAt = now;
    this.lastMessageAt = null;
    this.connectFailure = null;
    this.subscriptionId = null;
    throughput.reset(now);
  }

  void touched(Instant now) {
    this.lastMessageAt = now;
    throughput.record();
  }

  void acknowledged(String subscriptionId) {
    this.subscriptionId = subscriptionId;
  }

  void reconnecting() {
    this.state = State.RECONNECTING;
    this.socket = null;
    reconnects.incrementAndGet();
  }

  void closed() {
    this.state = State.CLOSED;
    this.socket = null;
  }

  void failed(ConnectFailure failure) {
    this.state = State.FAILED;
    this.socket = null;
    this.connectFailure = failure;
  }
}
