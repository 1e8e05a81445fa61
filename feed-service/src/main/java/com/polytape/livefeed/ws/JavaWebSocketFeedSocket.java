package com.polytape.livefeed.ws;

import lombok.extern.slf4j.Slf4j;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link FeedSocket} backed by the Java-WebSocket client. Callbacks arrive on the client's reader thread.
 */
@Slf4j
public class JavaWebSocketFeedSocket implements FeedSocket {

  private final Client client;
  private volatile boolean failed;

  public JavaWebSocketFeedSocket(URI uri, FeedSocketListener listener) {
    this.client = new Client(uri, listener);
    this.client.setConnectionLostTimeout(30);
  }

  public static FeedSocketFactory factory() {
    return JavaWebSocketFeedSocket::new;
  }

  @Override
  public Handshake connect(Duration timeout) throws InterruptedException {
    boolean open = client.connectBlocking(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (open && client.isOpen()) {
      return Handshake.OPEN;
    }
    if (failed || client.isClosed()) {
      return Handshake.FAILED;
    }
    client.close();
    return Handshake.TIMED_OUT;
  }

  @Override
  public void send(String text) {
    client.send(text);
  }

  @Override
  public void close(int code, String reason) {
    client.close(code, reason);
  }

  @Override
  public boolean isOpen() {
    return client.isOpen();
  }

  private final class Client extends WebSocketClient {

    private final FeedSocketListener listener;

    Client(URI serverUri, FeedSocketListener listener) {
      super(serverUri);
      this.listener = listener;
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
      listener.onOpen();
    }

    @Override
    public void onMessage(String message) {
      listener.onMessage(message);
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
      listener.onClose(code, reason, remote);
    }

    @Override
    public void onError(Exception ex) {
      failed = true;
      listener.onError(ex);
    }
  }
}
