package dev.compass.search;

import dev.compass.search.provider.SyntheticSearchProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered fallback chain over the configured {@link SearchProvider}s.
 *
 * <p>Providers are tried one at a time in ascending {@link SearchProvider#priority()}. Each call
 * runs on the search executor and is abandoned after {@code providerTimeout}. A timeout, an
 * exception or an empty result set counts as a decline and the chain moves on after {@code backoff}.
 * The first provider returning at least one result ends the chain; later providers are not called.
 *
 * <p>If every provider declines, the {@link SyntheticSearchProvider} generates placeholder results,
 * so {@link #search} never returns an empty set and never throws.
 */
public class SearchChain {

  private static final Logger log = LoggerFactory.getLogger(SearchChain.class);

  private final List<SearchProvider> providers;
  private final SyntheticSearchProvider lastResort;
  private final ExecutorService executor;
  private final Duration providerTimeout;
  private final Duration backoff;

  public SearchChain(
      List<SearchProvider> providers,
      SyntheticSearchProvider lastResort,
      ExecutorService executor,
      Duration providerTimeout,
      Duration backoff) {
    this.providers =
        providers.stream()
            .filter(provider -> provider != lastResort)
            .sorted(Comparator.comparingInt(SearchProvider::priority))
            .toList();
    this.lastResort = lastResort;
    this.executor = executor;
    this.providerTimeout = providerTimeout;
    this.backoff = backoff;
  }

  /**
   * Runs the chain and returns the winning results.
   *
   * @param query the search query
   * @param limit maximum results requested from each provider
   * @return a non-empty result set
   */
  public ResultSet search(@Nullable String query, int limit) {
    return execute(query, limit).resultSet();
  }

  /**
   * Runs the chain and returns the winning results together with the attempt trail.
   *
   * @param query the search query; null is treated as empty
   * @param limit maximum results requested from each provider, at least 1
   * @return the chain result; its result set is never empty
   */
  public ChainResult execute(@Nullable String query, int limit) {
    String text = query == null ? "" : query;
    int max = Math.max(1, limit);
    List<ProviderAttempt> attempts = new ArrayList<>();

    log.info("Starting search for '{}' (chain: {})", abbreviate(text), describeOrder());

    for (int i = 0; i < providers.size(); i++) {
      if (i > 0) {
        pause();
      }
      SearchProvider provider = providers.get(i);
      long started = System.nanoTime();
      ResultSet candidate = invoke(provider, text, max, attempts, started);
      if (candidate != null) {
        log.info("{} answered with {} results", provider.name(), candidate.size());
        return new ChainResult(candidate, attempts);
      }
    }

    long started = System.nanoTime();
    ResultSet fallback = lastResort.search(text, max);
    attempts.add(new ProviderAttempt(lastResort.name(), fallback.size(), null, since(started)));
    log.warn("All providers declined for '{}', using {}", abbreviate(text), lastResort.name());
    return new ChainResult(fallback, attempts);
  }

  /** Providers in the order they are tried, ending with the synthetic fallback. */
  public List<String> providerNames() {
    List<String> names = new ArrayList<>();
    providers.forEach(provider -> names.add(provider.name()));
    names.add(lastResort.name());
    return List.copyOf(names);
  }

  private @Nullable ResultSet invoke(
      SearchProvider provider,
      String query,
      int limit,
      List<ProviderAttempt> attempts,
      long started) {
    Future<ResultSet> future;
    try {
      future = executor.submit(() -> provider.search(query, limit));
    } catch (RejectedExecutionException e) {
      return decline(provider, "executor rejected the call", attempts, started);
    }

    try {
      ResultSet resultSet = future.get(providerTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (resultSet == null || resultSet.isEmpty()) {
        return decline(provider, "no results", attempts, started);
      }
      ResultSet stamped =
          provider.name().equals(resultSet.provider())
              ? resultSet
              : new ResultSet(resultSet.results(), provider.name());
      attempts.add(new ProviderAttempt(provider.name(), stamped.size(), null, since(started)));
      return stamped;
    } catch (TimeoutException e) {
      future.cancel(true);
      return decline(
          provider, "timed out after " + providerTimeout.toMillis() + "ms", attempts, started);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return decline(provider, "failed: " + cause.getMessage(), attempts, started);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return decline(provider, "interrupted", attempts, started);
    }
  }

  private @Nullable ResultSet decline(
      SearchProvider provider, String reason, List<ProviderAttempt> attempts, long started) {
    log.warn("{} declined: {}", provider.name(), reason);
    attempts.add(new ProviderAttempt(provider.name(), 0, reason, since(started)));
    return null;
  }

  private void pause() {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private String describeOrder() {
    return providerNames().stream().collect(Collectors.joining(" -> "));
  }

  private static Duration since(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }

  private static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}
