package dev.solvix.chatclient.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors with named daemon threads. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return task -> {
      Thread t = new Thread(task, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  /** Unbounded pool for blocking collaborator calls; idle threads are reclaimed. */
  public static ExecutorService newCachedThreadPool(String baseName) {
    return Executors.newCachedThreadPool(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "solvix-thread" : s;
  }
}
