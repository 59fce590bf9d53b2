package io.mediaplatform.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Legal status transitions for a media asset.
 *
 * <pre>
 *   UPLOADED   -&gt; PROCESSING | FAILED
 *   PROCESSING -&gt; READY | FAILED
 *   READY, FAILED are terminal
 * </pre>
 *
 * <p>A transition to the current status is always allowed. Callers treat it as a
 * no-op and skip all persistence side effects.
 */
public final class StatusTransitions {
  private static final Map<MediaStatus, Set<MediaStatus>> ALLOWED;

  static {
    Map<MediaStatus, Set<MediaStatus>> allowed = new EnumMap<>(MediaStatus.class);
    allowed.put(MediaStatus.UPLOADED, EnumSet.of(MediaStatus.PROCESSING, MediaStatus.FAILED));
    allowed.put(MediaStatus.PROCESSING, EnumSet.of(MediaStatus.READY, MediaStatus.FAILED));
    allowed.put(MediaStatus.READY, EnumSet.noneOf(MediaStatus.class));
    allowed.put(MediaStatus.FAILED, EnumSet.noneOf(MediaStatus.class));
    ALLOWED = Collections.unmodifiableMap(allowed);
  }

  private StatusTransitions() {}

  public static boolean canTransition(MediaStatus from, MediaStatus to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    return from == to || ALLOWED.get(from).contains(to);
  }

  /**
   * @throws InvalidTransitionException if {@code from -> to} is not a legal transition
   */
  public static void validate(MediaStatus from, MediaStatus to) {
    if (!canTransition(from, to)) {
      throw new InvalidTransitionException(from, to);
    }
  }

  public static boolean isTerminal(MediaStatus status) {
    Objects.requireNonNull(status, "status");
    return ALLOWED.get(status).isEmpty();
  }
}
