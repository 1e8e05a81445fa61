package com.polytape.livefeed.ws;

import java.time.Duration;

/**
 * A single streaming socket. Instances are used once: a reconnect always creates a new socket.
 */
public interface FeedSocket {

  /**
   * Opens the socket and blocks until the handshake completes, fails or {@code timeout} elapses.
   */
  Handshake connect(Duration timeout) throws InterruptedException;

  void send(String text);

  void close(int code, String reason);

  boolean isOpen();

  enum Handshake {
    OPEN,
    TIMED_OUT,
    FAILED
  }
}
