package com.polytape.livefeed.ws;

import com.polytape.config.FeedProperties;
import com.polytape.dome.DomeCodec;
import com.polytape.dome.DomeFrame;
import com.polytape.dome.SubscriptionUrlProvider;
import com.polytape.dome.TradeDecodeException;
import com.polytape.domain.Trade;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the streaming socket of the Dome order stream.
 *
 * Connect failures are reported to the caller and leave the session FAILED; nothing retries them automatically.
 * An opened socket that closes abnormally gets exactly one reconnect after a fixed backoff. Events from sockets
 * that were replaced in the meantime are ignored.
 */
@Slf4j
public class FeedConnection {

  private final SubscriptionUrlProvider urlProvider;
  private final FeedSocketFactory socketFactory;
  private final DomeCodec codec;
  private final ScheduledExecutorService loop;
  private final FeedProperties.Connection config;
  private final Clock clock;
  private final LiveFeedMetrics metrics;

  private final FeedSession session;
  private final AtomicLong generation = new AtomicLong();
  private final List<TradeListener> listeners = new CopyOnWriteArrayList<>();

  private volatile boolean errorSeen;
  private volatile ScheduledFuture<?> pendingReconnect;

  public FeedConnection(
      @NonNull SubscriptionUrlProvider urlProvider,
      @NonNull FeedSocketFactory socketFactory,
      @NonNull DomeCodec codec,
      @NonNull ScheduledExecutorService loop,
      @NonNull FeedProperties.Connection config,
      @NonNull Clock clock,
      @NonNull LiveFeedMetrics metrics
  ) {
    this.urlProvider = urlProvider;
    this.socketFactory = socketFactory;
    this.codec = codec;
    this.loop = loop;
    this.config = config;
    this.clock = clock;
    this.metrics = metrics;
    this.session = new FeedSession(clock.instant());
  }

  public void addTradeListener(TradeListener listener) {
    listeners.add(listener);
  }

  public FeedSession session() {
    return session;
  }

  /**
   * Opens the stream unless it is already open.
   */
  public synchronized FeedSession connect() throws FeedConnectException {
    if (session.isOpen()) {
      return session;
    }

    URI uri = session.subscriptionUrl();
    if (uri == null) {
      try {
        uri = urlProvider.subscriptionUrl();
      } catch (RuntimeException e) {
        throw fail(ConnectFailure.URL_UNAVAILABLE, "subscription url unavailable: " + e, e);
      }
      session.cacheSubscriptionUrl(uri);
    }

    long gen = generation.incrementAndGet();
    errorSeen = false;
    FeedSocket socket = socketFactory.create(uri, new SocketEvents(gen));
    session.connecting(socket, gen);

    FeedSocket.Handshake handshake;
    try {
      handshake = socket.connect(Duration.ofMillis(config.connectTimeoutMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      generation.incrementAndGet();
      socket.close(FeedCloseCodes.NORMAL, "interrupted");
      throw fail(ConnectFailure.TIMED_OUT, "interrupted while connecting", e);
    }

    if (handshake == FeedSocket.Handshake.TIMED_OUT) {
      generation.incrementAndGet();
      socket.close(FeedCloseCodes.NORMAL, "connect timeout");
      throw fail(ConnectFailure.TIMED_OUT,
          "no handshake within %dms".formatted(config.connectTimeoutMillis()), null);
    }
    if (handshake == FeedSocket.Handshake.FAILED || !socket.isOpen()) {
      generation.incrementAndGet();
      throw fail(ConnectFailure.HANDSHAKE_FAILED, "handshake failed", null);
    }

    session.opened(clock.instant());
    socket.send(codec.subscribeFrame());
    log.info("live feed connected (generation={}, reconnects={})", gen, session.reconnects());
    return session;
  }

  /**
   * Manual reconnect: retires the current socket without triggering the automatic path and connects at once.
   */
  public synchronized FeedSession reconnectNow() throws FeedConnectException {
    cancelPendingReconnect();
    retireCurrentSocket(FeedCloseCodes.MANUAL, "manual reconnect");
    metrics.reconnect(FeedCloseCodes.reasonTag(FeedCloseCodes.MANUAL));
    return connect();
  }

  /**
   * Closes the open socket with {@code code}; the resulting abnormal close runs the regular reconnect path.
   */
  public void forceReconnect(int code, String reason) {
    FeedSocket socket = session.socket();
    if (socket == null || !session.isOpen()) {
      return;
    }
    log.warn("forcing live feed reconnect (code={}, reason={})", code, reason);
    socket.close(code, reason);
  }

  /**
   * Normal close, no reconnect.
   */
  public synchronized void disconnect() {
    cancelPendingReconnect();
    retireCurrentSocket(FeedCloseCodes.NORMAL, "shutdown");
  }

  private void retireCurrentSocket(int code, String reason) {
    FeedSocket socket = session.socket();
    generation.incrementAndGet();
    session.closed();
    if (socket != null) {
      try {
        socket.close(code, reason);
      } catch (RuntimeException e) {
        log.debug("closing retired socket failed: {}", e.toString());
      }
    }
  }

  private void cancelPendingReconnect() {
    ScheduledFuture<?> pending = pendingReconnect;
    if (pending != null) {
      pending.cancel(false);
      pendingReconnect = null;
    }
  }

  private FeedConnectException fail(ConnectFailure failure, String message, Throwable cause) {
    session.failed(failure);
    metrics.connectFailed(failure.name());
    log.warn("live feed connect failed ({}): {}", failure, message);
    return cause == null
        ? new FeedConnectException(failure, message)
        : new FeedConnectException(failure, message, cause);
  }

  private synchronized void handleClose(long gen, int code, String reason) {
    if (gen != generation.get()) {
      return;
    }
    boolean wasOpen = session.isOpen();
    boolean abnormal = code != FeedCloseCodes.NORMAL || errorSeen;
    if (!wasOpen || !abnormal) {
      if (wasOpen) {
        log.info("live feed closed normally (code={})", code);
        session.closed();
      }
      return;
    }
    if (pendingReconnect != null && !pendingReconnect.isDone()) {
      return;
    }

    log.warn("live feed closed (code={}, reason={}), reconnecting in {}ms", code, reason, config.reconnectBackoffMillis());
    session.reconnecting();
    metrics.reconnect(FeedCloseCodes.reasonTag(code));
    pendingReconnect = loop.schedule(this::scheduledReconnect, config.reconnectBackoffMillis(), TimeUnit.MILLISECONDS);
  }

  private void scheduledReconnect() {
    synchronized (this) {
      pendingReconnect = null;
      if (session.state() != FeedSession.State.RECONNECTING) {
        return;
      }
    }
    try {
      connect();
    } catch (FeedConnectException e) {
      log.warn("scheduled reconnect failed, waiting for manual reconnect: {}", e.getMessage());
    }
  }

  private void handleMessage(long gen, String text) {
    if (gen != generation.get()) {
      return;
    }
    metrics.frameReceived();

    DomeFrame frame;
    try {
      frame = codec.parseFrame(text);
    } catch (TradeDecodeException e) {
      metrics.frameDropped("malformed");
      log.debug("dropping malformed frame: {}", e.getMessage());
      return;
    }
    session.touched(clock.instant());

    switch (frame.kind()) {
      case ACK -> {
        session.acknowledged(frame.subscriptionId());
        log.info("live feed subscription acknowledged (subscriptionId={})", frame.subscriptionId());
      }
      case EVENT -> deliver(frame);
      case OTHER -> log.debug("ignoring frame: {}", text);
    }
  }

  private void deliver(DomeFrame frame) {
    Trade trade;
    try {
      trade = codec.decodeTrade(frame.data());
    } catch (TradeDecodeException e) {
      metrics.frameDropped("undecodable");
      log.debug("dropping undecodable trade event: {}", e.getMessage());
      return;
    }
    metrics.tradeDecoded();
    for (TradeListener listener : listeners) {
      try {
        listener.onTrade(trade);
      } catch (Exception e) {
        log.warn("trade listener failed: {}", e.toString());
      }
    }
  }

  private final class SocketEvents implements FeedSocketListener {

    private final long gen;

    SocketEvents(long gen) {
      this.gen = gen;
    }

    @Override
    public void onOpen() {
      log.debug("live feed socket open (generation={})", gen);
    }

    @Override
    public void onMessage(String text) {
      handleMessage(gen, text);
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
      // the client invokes this before releasing a blocked connect, so hand it to the loop
      loop.execute(() -> handleClose(gen, code, reason));
    }

    @Override
    public void onError(Exception error) {
      if (gen == generation.get()) {
        errorSeen = true;
        log.warn("live feed socket error: {}", error.toString());
      }
    }
  }
}
