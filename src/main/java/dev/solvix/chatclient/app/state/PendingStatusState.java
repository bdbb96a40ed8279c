package dev.solvix.chatclient.app.state;

import dev.solvix.chatclient.model.MessageStatus;
import dev.solvix.chatclient.model.StatusLattice;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Status reports for server ids the session does not know yet.
 *
 * <p>A receipt can overtake the correlation confirmation that tells the session which message it
 * is for. Reports are held for a bounded time, combined with the lattice rule, and handed out once
 * an entry acquires the id.
 */
public class PendingStatusState {

  private record Pending(MessageStatus status, Instant receivedAt) {}

  private final Duration retention;
  private final int maxEntries;
  private final Clock clock;
  private final LinkedHashMap<Long, Pending> pending = new LinkedHashMap<>();

  public PendingStatusState(Duration retention, int maxEntries, Clock clock) {
    this.retention =
        (retention == null || retention.isNegative() || retention.isZero())
            ? Duration.ofMinutes(2)
            : retention;
    this.maxEntries = Math.max(1, maxEntries);
    this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
  }

  public synchronized void remember(long serverId, MessageStatus status) {
    if (serverId <= 0 || status == null) return;
    Instant now = clock.instant();
    purgeExpired(now);
    Pending prev = pending.remove(serverId);
    MessageStatus merged = StatusLattice.apply(prev == null ? null : prev.status(), status);
    pending.put(serverId, new Pending(merged, now));
    while (pending.size() > maxEntries) {
      Iterator<Long> it = pending.keySet().iterator();
      it.next();
      it.remove();
    }
  }

  /** Removes and returns the buffered status for {@code serverId}, if still retained. */
  public synchronized Optional<MessageStatus> take(long serverId) {
    if (serverId <= 0) return Optional.empty();
    purgeExpired(clock.instant());
    Pending p = pending.remove(serverId);
    return p == null ? Optional.empty() : Optional.of(p.status());
  }

  public synchronized int size() {
    purgeExpired(clock.instant());
    return pending.size();
  }

  public synchronized void clear() {
    pending.clear();
  }

  private void purgeExpired(Instant now) {
    Instant cutoff = now.minus(retention);
    Iterator<Map.Entry<Long, Pending>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().receivedAt().isBefore(cutoff)) it.remove();
    }
  }
}
