package com.polytape.dome;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One parsed frame of the order stream.
 */
public record DomeFrame(
    Kind kind,
    String subscriptionId,     // set on ACK frames
    JsonNode data              // raw trade payload on EVENT frames
) {

  public enum Kind {
    ACK,
    EVENT,
    OTHER
  }
}
