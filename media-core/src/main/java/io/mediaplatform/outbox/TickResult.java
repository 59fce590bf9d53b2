package io.mediaplatform.outbox;

/**
 * Outcome of one {@link OutboxPublisher#tick()}.
 *
 * @param fetched   pending records read from the store
 * @param published records the broker accepted
 * @param failed    records whose publish failed; they stay pending
 * @param marked    published records marked processed
 * @param aborted   {@code true} if the tick failed before or while fetching
 */
public record TickResult(int fetched, int published, int failed, int marked, boolean aborted) {
  static final TickResult EMPTY = new TickResult(0, 0, 0, 0, false);
  static final TickResult ABORTED = new TickResult(0, 0, 0, 0, true);

  /** Published but not marked; these will be published again. */
  public int unmarked() {
    return published - marked;
  }
}
