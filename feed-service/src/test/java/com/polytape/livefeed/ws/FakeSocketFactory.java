package com.polytape.livefeed.ws;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Hands out scripted sockets. Each created socket takes the next queued handshake outcome, OPEN by default.
 */
final class FakeSocketFactory implements FeedSocketFactory {

  final List<FakeSocket> sockets = new ArrayList<>();
  final List<URI> uris = new ArrayList<>();
  private final Deque<FeedSocket.Handshake> outcomes = new ArrayDeque<>();

  void nextHandshake(FeedSocket.Handshake outcome) {
    outcomes.addLast(outcome);
  }

  FakeSocket last() {
    return sockets.get(sockets.size() - 1);
  }

  @Override
  public FeedSocket create(URI uri, FeedSocketListener listener) {
    FeedSocket.Handshake outcome = outcomes.isEmpty() ? FeedSocket.Handshake.OPEN : outcomes.removeFirst();
    FakeSocket socket = new FakeSocket(listener, outcome);
    uris.add(uri);
    sockets.add(socket);
    return socket;
  }

  static final class FakeSocket implements FeedSocket {

    final FeedSocketListener listener;
    final Handshake outcome;
    final List<String> sent = new ArrayList<>();
    final List<Integer> closeCodes = new ArrayList<>();
    private boolean open;

    FakeSocket(FeedSocketListener listener, Handshake outcome) {
      this.listener = listener;
      this.outcome = outcome;
    }

    @Override
    public Handshake connect(Duration timeout) {
      if (outcome == Handshake.OPEN) {
        open = true;
        listener.onOpen();
      }
      return outcome;
    }

    @Override
    public void send(String text) {
      sent.add(text);
    }

    @Override
    public void close(int code, String reason) {
      closeCodes.add(code);
      if (open) {
        open = false;
        listener.onClose(code, reason, false);
      }
    }

    @Override
    public boolean isOpen() {
      return open;
    }

    void receive(String text) {
      listener.onMessage(text);
    }

    void serverClose(int code) {
      open = false;
      listener.onClose(code, "", true);
    }

    void fail(Exception error) {
      listener.onError(error);
    }
  }
}
