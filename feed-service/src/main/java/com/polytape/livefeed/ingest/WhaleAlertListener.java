package com.polytape.livefeed.ingest;

@FunctionalInterface
public interface WhaleAlertListener {

  void onWhaleAlert(WhaleAlert alert);
}
