package com.polytape.livefeed.ws;

public enum ConnectFailure {
  /** The subscription URL could not be obtained. */
  URL_UNAVAILABLE,
  /** No handshake within the connect timeout. */
  TIMED_OUT,
  /** The socket errored or closed during the handshake. */
  HANDSHAKE_FAILED
}
