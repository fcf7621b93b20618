package dev.compass.router;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe log of routing decisions, oldest first.
 *
 * <p>Once {@code capacity} entries are held, each append evicts the oldest one. All access goes
 * through one monitor, so a {@link #snapshot()} never sees a half-applied append.
 */
public class RoutingHistory {

  private final int capacity;
  private final Deque<RoutingHistoryEntry> entries;

  public RoutingHistory(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("History capacity must be positive, got: " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  public synchronized void append(RoutingHistoryEntry entry) {
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(entry);
  }

  /** Immutable copy of the retained entries in append order. */
  public synchronized List<RoutingHistoryEntry> snapshot() {
    return List.copyOf(entries);
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }
}
