package com.polytape.livefeed.view;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wallets the operator follows. Addresses are stored lower-cased.
 */
public class TrackedWallets {

  private final Set<String> wallets = ConcurrentHashMap.newKeySet();

  public boolean track(String wallet) {
    String key = normalize(wallet);
    return key != null && wallets.add(key);
  }

  public boolean untrack(String wallet) {
    String key = normalize(wallet);
    return key != null && wallets.remove(key);
  }

  public boolean isTracked(String wallet) {
    String key = normalize(wallet);
    return key != null && wallets.contains(key);
  }

  public Set<String> snapshot() {
    return Set.copyOf(wallets);
  }

  public static String normalize(String wallet) {
    if (wallet == null || wallet.isBlank()) {
      return null;
    }
    return wallet.trim().toLowerCase(Locale.ROOT);
  }
}
