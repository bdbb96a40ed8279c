package dev.solvix.chatclient.app.util;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One-shot timer with restart/stop semantics.
 *
 * <p>Restarting cancels the pending run. Used for the eviction of failed messages, one timer per
 * correlation token.
 */
public final class RestartableRxTimer implements AutoCloseable {
  private final Scheduler scheduler;
  private final Consumer<Throwable> onError;
  private final AtomicReference<Disposable> current = new AtomicReference<>();

  public RestartableRxTimer(Scheduler scheduler) {
    this(scheduler, null);
  }

  public RestartableRxTimer(Scheduler scheduler, Consumer<Throwable> onError) {
    this.scheduler = Objects.requireNonNullElse(scheduler, Schedulers.computation());
    this.onError = Objects.requireNonNullElse(onError, err -> {});
  }

  public void restart(Duration delay, Runnable action) {
    restart(delay == null ? 0L : delay.toMillis(), TimeUnit.MILLISECONDS, action);
  }

  public void restart(long delay, TimeUnit unit, Runnable action) {
    stop();
    if (action == null) return;

    try {
      Disposable next =
          Completable.timer(Math.max(0L, delay), unit, scheduler)
              .subscribe(action::run, onError::accept);
      current.set(next);
    } catch (RuntimeException e) {
      onError.accept(e);
    }
  }

  public boolean isPending() {
    Disposable d = current.get();
    return d != null && !d.isDisposed();
  }

  public void stop() {
    Disposable prev = current.getAndSet(null);
    if (prev != null && !prev.isDisposed()) {
      prev.dispose();
    }
  }

  @Override
  public void close() {
    stop();
  }
}
