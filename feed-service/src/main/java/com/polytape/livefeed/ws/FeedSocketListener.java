package com.polytape.livefeed.ws;

public interface FeedSocketListener {

  void onOpen();

  void onMessage(String text);

  void onClose(int code, String reason, boolean remote);

  void onError(Exception error);
}
