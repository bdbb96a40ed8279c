package dev.solvix.chatclient.realtime;

import dev.solvix.chatclient.model.ChatId;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes events of the shared {@link RealtimeChannel} to per-chat subscribers.
 *
 * <p>The registry holds a single upstream subscription, opened with the first subscriber. Chat
 * scoped events go to the subscribers of that chat; connection state events go to everybody.
 */
@Component
public class RealtimeSubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(RealtimeSubscriptionRegistry.class);

  /** Handle for one subscriber. Closing is idempotent. */
  public interface Subscription extends AutoCloseable {
    ChatId chatId();

    boolean isActive();

    @Override
    void close();
  }

  private final RealtimeChannel channel;
  private final Map<Long, Registration> subscribers = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  private final Object upstreamLock = new Object();
  private Disposable upstream;

  public RealtimeSubscriptionRegistry(RealtimeChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  public Subscription subscribe(ChatId chatId, Consumer<RealtimeEvent> handler) {
    Objects.requireNonNull(chatId, "chatId");
    Objects.requireNonNull(handler, "handler");
    ensureUpstream();
    long id = ids.incrementAndGet();
    Registration reg = new Registration(id, chatId, handler);
    subscribers.put(id, reg);
    log.debug("[solvix] Subscribed session #{} to chat {}", id, chatId);
    return reg;
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  public int subscriberCount(ChatId chatId) {
    int n = 0;
    for (Registration reg : subscribers.values()) {
      if (reg.chatId.equals(chatId)) n++;
    }
    return n;
  }

  @PreDestroy
  public void shutdown() {
    synchronized (upstreamLock) {
      if (upstream != null) upstream.dispose();
      upstream = null;
    }
    subscribers.clear();
  }

  void dispatch(RealtimeEvent event) {
    if (event == null) return;
    ChatId scope = event.chatId();
    for (Registration reg : subscribers.values()) {
      if (scope != null && !scope.equals(reg.chatId)) continue;
      try {
        reg.handler.accept(event);
      } catch (RuntimeException e) {
        log.error("[solvix] Realtime handler for chat {} failed on {}", reg.chatId, event, e);
      }
    }
  }

  private void ensureUpstream() {
    synchronized (upstreamLock) {
      if (upstream != null && !upstream.isDisposed()) return;
      Flowable<RealtimeEvent> events = channel.events();
      if (events == null) {
        log.warn("[solvix] Realtime channel exposes no event stream; sessions will rely on the API only");
        return;
      }
      upstream =
          events.subscribe(
              this::dispatch,
              err -> log.error("[solvix] Realtime event stream terminated with an error", err));
    }
  }

  private final class Registration implements Subscription {
    private final long id;
    private final ChatId chatId;
    private final Consumer<RealtimeEvent> handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(long id, ChatId chatId, Consumer<RealtimeEvent> handler) {
      this.id = id;
      this.chatId = chatId;
      this.handler = handler;
    }

    @Override
    public ChatId chatId() {
      return chatId;
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public void close() {
      if (!active.compareAndSet(true, false)) return;
      subscribers.remove(id);
      log.debug("[solvix] Unsubscribed session #{} from chat {}", id, chatId);
    }
  }
}
