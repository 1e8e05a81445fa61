package com.polytape.dome;

import java.net.URI;

/**
 * Source of the streaming subscription URL. Implementations may block on I/O and throw any runtime exception
 * when the URL cannot be obtained.
 */
public interface SubscriptionUrlProvider {

  URI subscriptionUrl();
}
