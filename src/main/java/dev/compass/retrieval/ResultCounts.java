package dev.compass.retrieval;

/** Number of sources contributed by each side of a retrieval. */
public record ResultCounts(int local, int web) {

  private static final ResultCounts NONE = new ResultCounts(0, 0);

  public static ResultCounts none() {
    return NONE;
  }

  public int total() {
    return local + web;
  }
}
