package com.polytape.livefeed.ws;

import java.net.URI;

@FunctionalInterface
public interface FeedSocketFactory {

  FeedSocket create(URI uri, FeedSocketListener listener);
}
