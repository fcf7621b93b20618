package dev.compass.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.compass.retrieval.RetrievalType;
import dev.compass.routing.Datasource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RoutingHistoryTest {

  private static RoutingHistoryEntry entry(String query) {
    return new RoutingHistoryEntry(
        query, Datasource.WEB, "r", 0.8, RetrievalType.WEB, 1, null, Instant.EPOCH);
  }

  @Test
  void keepsEntriesInAppendOrder() {
    RoutingHistory history = new RoutingHistory(10);
    history.append(entry("a"));
    history.append(entry("b"));

    assertThat(history.snapshot())
        .extracting(RoutingHistoryEntry::query)
        .containsExactly("a", "b");
  }

  @Test
  void evictsOldestOnceFull() {
    RoutingHistory history = new RoutingHistory(2);
    history.append(entry("a"));
    history.append(entry("b"));
    history.append(entry("c"));

    assertThat(history.size()).isEqualTo(2);
    assertThat(history.snapshot())
        .extracting(RoutingHistoryEntry::query)
        .containsExactly("b", "c");
  }

  @Test
  void snapshotIsDetachedFromLaterAppends() {
    RoutingHistory history = new RoutingHistory(5);
    history.append(entry("a"));
    List<RoutingHistoryEntry> snapshot = history.snapshot();

    history.append(entry("b"));

    assertThat(snapshot).hasSize(1);
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new RoutingHistory(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concurrentAppendsAreAllRecorded() throws Exception {
    RoutingHistory history = new RoutingHistory(10_000);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < 8; t++) {
        int thread = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 500; i++) {
                    history.append(entry(thread + "-" + i));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(history.size()).isEqualTo(4000);
  }
}
