package dev.solvix.chatclient.config;

import dev.solvix.chatclient.util.ChatSchedulers;
import dev.solvix.chatclient.util.NamedThreads;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Reconciliation runs on one thread so store mutations stay ordered; I/O and timers get their
 * own executors so a slow collaborator never delays inbound events.
 */
@Configuration
public class ExecutorConfig {
  public static final String CHAT_RECONCILE_EXECUTOR = "chatReconcileExecutor";
  public static final String CHAT_IO_EXECUTOR = "chatIoExecutor";
  public static final String CHAT_TIMER_SCHEDULER = "chatTimerScheduler";

  @Bean(name = CHAT_RECONCILE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService chatReconcileExecutor() {
    return NamedThreads.newSingleThreadExecutor("solvix-reconcile");
  }

  @Bean(name = CHAT_IO_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService chatIoExecutor() {
    return NamedThreads.newCachedThreadPool("solvix-chat-io");
  }

  @Bean(name = CHAT_TIMER_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService chatTimerScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("solvix-chat-timer");
  }

  @Bean
  public ChatSchedulers chatSchedulers(
      @Qualifier(CHAT_RECONCILE_EXECUTOR) ExecutorService reconcile,
      @Qualifier(CHAT_IO_EXECUTOR) ExecutorService io,
      @Qualifier(CHAT_TIMER_SCHEDULER) ScheduledExecutorService timer) {
    return new ChatSchedulers(
        Schedulers.from(reconcile), Schedulers.from(io), Schedulers.from(timer));
  }
}
