package com.polytape.domain;

/**
 * Heuristic tag attached to a trade from its wallet's activity profile. Computed on demand, never stored.
 */
public record AnomalySignal(
    SignalType type,
    String detail              // e.g. "Wallet age: 4h", "8x avg size"
) {
}
