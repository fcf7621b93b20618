package dev.compass.search;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Record of one provider invocation inside the chain.
 *
 * @param provider provider name
 * @param resultCount number of results returned, 0 when declined
 * @param declineReason why the provider declined, null when it answered
 * @param elapsed wall time spent waiting on the provider
 */
public record ProviderAttempt(
    String provider, int resultCount, @Nullable String declineReason, Duration elapsed) {

  public boolean answered() {
    return declineReason == null;
  }
}
