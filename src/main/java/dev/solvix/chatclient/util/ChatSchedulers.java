package dev.solvix.chatclient.util;

import io.reactivex.rxjava3.core.Scheduler;
import java.util.Objects;

/**
 * Schedulers used by chat sessions.
 *
 * @param reconcile serialized scheduler applying collaborator results and read marking
 * @param io collaborator calls (real-time channel, API)
 * @param timer timeouts and eviction timers
 */
public record ChatSchedulers(Scheduler reconcile, Scheduler io, Scheduler timer) {
  public ChatSchedulers {
    Objects.requireNonNull(reconcile, "reconcile");
    Objects.requireNonNull(io, "io");
    Objects.requireNonNull(timer, "timer");
  }
}
