package dev.solvix.chatclient.app.core;

import dev.solvix.chatclient.api.ChatApi;
import dev.solvix.chatclient.api.CurrentUserProvider;
import dev.solvix.chatclient.app.api.NotificationKind;
import dev.solvix.chatclient.app.api.UserNotificationPort;
import dev.solvix.chatclient.app.outbound.DeliveryOutcome;
import dev.solvix.chatclient.app.outbound.MessageDeliveryDispatcher;
import dev.solvix.chatclient.app.outbound.ReadReceiptDispatcher;
import dev.solvix.chatclient.app.state.ChatMessageStore;
import dev.solvix.chatclient.app.state.ChatSummaryState;
import dev.solvix.chatclient.app.state.MessageIdentityResolver;
import dev.solvix.chatclient.app.state.PendingStatusState;
import dev.solvix.chatclient.app.util.RestartableRxTimer;
import dev.solvix.chatclient.config.ChatProperties;
import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.InvalidChatReferenceException;
import dev.solvix.chatclient.model.MessageStatus;
import dev.solvix.chatclient.realtime.RealtimeChannel;
import dev.solvix.chatclient.realtime.RealtimeEvent;
import dev.solvix.chatclient.realtime.RealtimeSubscriptionRegistry;
import dev.solvix.chatclient.util.ChatSchedulers;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the message stream of the chat currently on screen.
 *
 * <p>Local sends appear at once as optimistic entries and are then reconciled with whatever the
 * server reports: send responses, pushed messages, correlation confirmations and receipts. One
 * engine shows one chat at a time; {@link #open(String)} on another chat tears the previous
 * session down and discards its late results.
 *
 * <p>Collaborator failures never escape: they end up in the log, as a transient notification, or
 * as a {@link MessageStatus#FAILED} entry.
 */
@ApplicationLayer
public class ChatSessionEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChatSessionEngine.class);

  private final RealtimeSubscriptionRegistry registry;
  private final RealtimeChannel realtime;
  private final ChatApi api;
  private final CurrentUserProvider users;
  private final MessageDeliveryDispatcher delivery;
  private final ReadReceiptDispatcher receipts;
  private final ChatSummaryState summaries;
  private final UserNotificationPort notifications;
  private final ChatProperties props;
  private final ChatSchedulers schedulers;
  private final Clock clock;
  private final MessageIdentityResolver resolver;

  private final BehaviorProcessor<Optional<ChatMessageStore>> stores =
      BehaviorProcessor.createDefault(Optional.empty());
  private final BehaviorProcessor<Boolean> connectionStates = BehaviorProcessor.createDefault(false);
  private final FlowableProcessor<RealtimeEvent.UserTyping> typingEvents =
      PublishProcessor.<RealtimeEvent.UserTyping>create().toSerialized();

  private final Object lock = new Object();
  private volatile Session session;
  private volatile long generation;
  private volatile ChatSessionState state = ChatSessionState.IDLE;

  public ChatSessionEngine(
      RealtimeSubscriptionRegistry registry,
      RealtimeChannel realtime,
      ChatApi api,
      CurrentUserProvider users,
      MessageDeliveryDispatcher delivery,
      ReadReceiptDispatcher receipts,
      ChatSummaryState summaries,
      UserNotificationPort notifications,
      ChatProperties props,
      ChatSchedulers schedulers,
      Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.realtime = Objects.requireNonNull(realtime, "realtime");
    this.api = Objects.requireNonNull(api, "api");
    this.users = Objects.requireNonNull(users, "users");
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.receipts = Objects.requireNonNull(receipts, "receipts");
    this.summaries = Objects.requireNonNull(summaries, "summaries");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.props = Objects.requireNonNull(props, "props");
    this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
    this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
    this.resolver = new MessageIdentityResolver(props.identityMatchTolerance());
  }

  /** Per-chat state. Replaced wholesale when another chat is opened. */
  private final class Session {
    private final ChatId chatId;
    private final long generation;
    private final ChatMessageStore store;
    private final PendingStatusState earlyStatuses;
    private final CompositeDisposable disposables = new CompositeDisposable();
    private final Map<String, RestartableRxTimer> evictions = new ConcurrentHashMap<>();
    private RealtimeSubscriptionRegistry.Subscription subscription;
    private Completable initialization;
    private Completable pageLoad;
    private volatile boolean canLoadMore = true;
    private volatile boolean closed;
    private Boolean lastTyping;

    private Session(ChatId chatId, long generation) {
      this.chatId = chatId;
      this.generation = generation;
      this.store = new ChatMessageStore(chatId, resolver, users::currentUserId, clock);
      this.earlyStatuses =
          new PendingStatusState(
              props.earlyStatus().retention(), props.earlyStatus().maxEntries(), clock);
    }
  }

  /**
   * Shows {@code rawChatId}.
   *
   * <p>Opening the chat that is already open returns its initialization. An invalid reference is
   * reported to the user and leaves the engine unchanged.
   *
   * @return completes once the first page is loaded; never signals an error
   */
  public Completable open(String rawChatId) {
    ChatId chatId;
    try {
      chatId = ChatId.parse(rawChatId);
    } catch (InvalidChatReferenceException e) {
      log.warn("[solvix] Refusing to open chat: {}", e.getMessage());
      notifications.showTransient(NotificationKind.ERROR, "This chat link is not valid.");
      return Completable.complete();
    }

    Session next;
    synchronized (lock) {
      Session current = session;
      if (current != null && current.chatId.equals(chatId)) {
        return current.initialization;
      }
      teardown(current);
      next = new Session(chatId, ++generation);
      session = next;
      state = ChatSessionState.LOADING;
      stores.onNext(Optional.of(next.store));
      connectionStates.onNext(realtime.isConnected());
      Session s = next;
      next.subscription =
          registry.subscribe(
              chatId, ev -> schedulers.reconcile().scheduleDirect(() -> onRealtimeEvent(s, ev)));
      next.initialization = initialize(next).cache();
    }

    log.debug("[solvix] Opening chat {} (session #{})", chatId, next.generation);
    if (!users.isAuthenticated()) {
      notifications.showTransient(
          NotificationKind.AUTH, chatId, "You are signed out. Messages are read-only.");
    }
    next.disposables.add(next.initialization.subscribe());
    return next.initialization;
  }

  /**
   * Adds {@code content} as an optimistic message and starts its delivery.
   *
   * <p>The optimistic entry is written on the calling thread so that it is visible on return;
   * the delivery outcome is reconciled on the reconcile scheduler.
   *
   * @return the optimistic entry; empty for blank input, without an open chat or without a user
   */
  public Optional<ChatMessage> send(String content) {
    Session s = session;
    if (s == null || s.closed) {
      log.debug("[solvix] send ignored: no chat open");
      return Optional.empty();
    }
    String text = Objects.toString(content, "").trim();
    if (text.isEmpty()) return Optional.empty();

    long me = users.currentUserId();
    if (me <= CurrentUserProvider.UNAUTHENTICATED) {
      notifications.showTransient(
          NotificationKind.AUTH, s.chatId, "Sign in again to send messages.");
      return Optional.empty();
    }

    ChatMessage optimistic = delivery.prepare(s.chatId, me, text);
    ChatMessage stored = s.store.upsert(optimistic).message();
    summaries.onMessageInserted(stored, false);
    s.disposables.add(
        delivery
            .dispatch(stored)
            .observeOn(schedulers.reconcile())
            .subscribe(
                outcome -> onDeliveryOutcome(s, outcome),
                err ->
                    log.error(
                        "[solvix] Delivery of {} ended unexpectedly",
                        stored.correlationToken(),
                        err)));
    return Optional.of(stored);
  }

  /**
   * Sends the content of a failed message again as a new message.
   *
   * <p>The failed entry disappears at once; the resubmission carries a new correlation token.
   */
  public Optional<ChatMessage> retry(String correlationToken) {
    Session s = session;
    if (s == null || s.closed) return Optional.empty();
    Optional<ChatMessage> failed =
        s.store.findByCorrelation(correlationToken).filter(m -> m.status() == MessageStatus.FAILED);
    if (failed.isEmpty()) {
      log.debug("[solvix] retry ignored: {} is not a failed message", correlationToken);
      return Optional.empty();
    }
    if (!users.isAuthenticated()) {
      notifications.showTransient(
          NotificationKind.AUTH, s.chatId, "Sign in again to send messages.");
      return Optional.empty();
    }
    cancelEviction(s, correlationToken);
    s.store.removeByCorrelation(correlationToken);
    return send(failed.get().content());
  }

  /**
   * Fetches the page before the oldest loaded message.
   *
   * <p>Concurrent callers share one request. Does nothing once the server returned a short page.
   */
  public Completable loadOlderMessages() {
    Session s = session;
    if (s == null || s.closed || !s.canLoadMore) return Completable.complete();
    Completable op;
    synchronized (lock) {
      if (s.pageLoad != null) return s.pageLoad;
      int offset = s.store.size();
      int limit = props.pageSize();
      op =
          fetchPage(s, offset, limit)
              .ignoreElement()
              .doOnError(
                  err -> {
                    log.warn("[solvix] Loading older messages of {} failed", s.chatId, err);
                    notifications.showTransient(
                        NotificationKind.WARNING, s.chatId, "Could not load older messages.");
                  })
              .onErrorComplete()
              .doFinally(() -> clearPageLoad(s))
              .cache();
      s.pageLoad = op;
    }
    s.disposables.add(op.subscribe());
    return op;
  }

  /**
   * Marks incoming messages read locally, then tells the server. The local update runs on the
   * reconcile scheduler.
   */
  public void markVisibleAsRead(Collection<Long> serverIds) {
    Session s = session;
    if (s == null || s.closed || serverIds == null || serverIds.isEmpty()) return;
    if (!users.isAuthenticated()) {
      notifications.showTransient(
          NotificationKind.AUTH, s.chatId, "Sign in again to sync read status.");
      return;
    }
    List<Long> ids = new ArrayList<>(serverIds);
    schedulers
        .reconcile()
        .scheduleDirect(
            () -> {
              if (isCurrent(s)) markRead(s, ids);
            });
  }

  /** Forwards the local user's typing state when it changed and the channel is up. */
  public void setTyping(boolean typing) {
    Session s = session;
    if (s == null || s.closed || !realtime.isConnected()) return;
    synchronized (lock) {
      if (Objects.equals(s.lastTyping, typing)) return;
      s.lastTyping = typing;
    }
    s.disposables.add(
        Completable.defer(() -> realtime.sendTyping(s.chatId, typing))
            .subscribeOn(schedulers.io())
            .subscribe(
                () -> {},
                err -> log.debug("[solvix] typing notification for {} failed", s.chatId, err)));
  }

  /** Leaves the current chat. Idempotent. */
  @Override
  public void close() {
    synchronized (lock) {
      if (session == null) return;
      teardown(session);
      session = null;
      state = ChatSessionState.CLOSED;
      stores.onNext(Optional.empty());
    }
  }

  public Optional<ChatId> currentChatId() {
    Session s = session;
    return s == null ? Optional.empty() : Optional.of(s.chatId);
  }

  public ChatSessionState state() {
    return state;
  }

  /** Messages of the open chat in display order. */
  public List<ChatMessage> messages() {
    Session s = session;
    return s == null ? List.of() : s.store.snapshot();
  }

  public boolean canLoadMore() {
    Session s = session;
    return s != null && s.canLoadMore;
  }

  /** Store changes of whichever chat is open; switches with {@link #open(String)}. */
  public Flowable<ChatMessageStore.Change> changes() {
    return stores.switchMap(
        store -> store.map(ChatMessageStore::changes).orElse(Flowable.<ChatMessageStore.Change>empty()));
  }

  public Flowable<Boolean> connectionStates() {
    return connectionStates.distinctUntilChanged();
  }

  /** Typing notifications of other users in the open chat. */
  public Flowable<RealtimeEvent.UserTyping> typingEvents() {
    return typingEvents.onBackpressureLatest();
  }

  private Completable initialize(Session s) {
    Completable connect =
        Completable.defer(() -> realtime.isConnected() ? Completable.complete() : realtime.connect())
            .subscribeOn(schedulers.io())
            .doOnError(err -> log.warn("[solvix] Real-time connect failed; using the API only", err))
            .onErrorComplete();

    Completable seedSummary =
        Maybe.defer(() -> api.getChat(s.chatId))
            .subscribeOn(schedulers.io())
            .observeOn(schedulers.reconcile())
            .doOnSuccess(
                summary -> {
                  if (isCurrent(s) && s.chatId.equals(summary.chatId())) summaries.seed(summary);
                })
            .doOnComplete(() -> summaries.ensure(s.chatId))
            .ignoreElement()
            .doOnError(err -> log.warn("[solvix] Could not load details of chat {}", s.chatId, err))
            .onErrorComplete();

    Completable firstPage =
        fetchPage(s, 0, props.initialPageSize())
            .ignoreElement()
            .doOnError(
                err -> {
                  log.warn("[solvix] Loading messages of {} failed", s.chatId, err);
                  notifications.showTransient(
                      NotificationKind.ERROR, s.chatId, "Could not load messages.");
                })
            .onErrorComplete();

    Completable readVisible =
        Completable.fromAction(
            () -> {
              if (isCurrent(s) && users.isAuthenticated()) {
                markRead(s, s.store.unreadIncomingServerIds());
              }
            });

    return connect
        .andThen(seedSummary)
        .andThen(firstPage)
        .andThen(readVisible)
        .doOnComplete(
            () -> {
              if (isCurrent(s)) state = ChatSessionState.READY;
            });
  }

  private Single<List<ChatMessage>> fetchPage(Session s, int offset, int limit) {
    return Single.defer(() -> api.getMessages(s.chatId, offset, limit))
        .subscribeOn(schedulers.io())
        .observeOn(schedulers.reconcile())
        .map(
            page -> {
              if (!isCurrent(s)) {
                log.debug("[solvix] Discarding page of closed session #{}", s.generation);
                return List.<ChatMessage>of();
              }
              List<ChatMessage> normalized = new ArrayList<>(page.size());
              for (ChatMessage m : page) {
                if (m != null && s.chatId.equals(m.chatId())) normalized.add(fromServer(m));
              }
              List<ChatMessage> inserted = s.store.prepend(normalized);
              s.canLoadMore = page.size() == limit;
              for (ChatMessage m : inserted) {
                summaries.onMessageInserted(m, false);
                applyEarlyStatus(s, m);
              }
              return inserted;
            });
  }

  private void clearPageLoad(Session s) {
    synchronized (lock) {
      s.pageLoad = null;
    }
  }

  private void onDeliveryOutcome(Session s, DeliveryOutcome outcome) {
    if (!isCurrent(s)) return;
    String token = outcome.correlationToken();
    if (outcome instanceof DeliveryOutcome.Confirmed confirmed) {
      ChatMessage server = confirmed.serverMessage();
      if (!s.chatId.equals(server.chatId())) {
        log.warn("[solvix] Send response for {} names chat {}", token, server.chatId());
        s.store.applyStatusByCorrelation(token, MessageStatus.SENT);
        return;
      }
      ChatMessage stored = s.store.upsert(fromServer(server)).message();
      applyEarlyStatus(s, stored);
    } else if (outcome instanceof DeliveryOutcome.Accepted) {
      s.store.applyStatusByCorrelation(token, MessageStatus.SENT);
    } else if (outcome instanceof DeliveryOutcome.Failed failed) {
      Optional<ChatMessage> entry = s.store.findByCorrelation(token);
      if (entry.isEmpty() || entry.get().hasServerId()) {
        log.debug("[solvix] Ignoring delivery failure of {}: already resolved", token);
        return;
      }
      Optional<ChatMessage> marked = s.store.applyStatusByCorrelation(token, MessageStatus.FAILED);
      if (marked.isPresent() && marked.get().status() == MessageStatus.FAILED) {
        notifications.showTransient(
            NotificationKind.ERROR, s.chatId, "Message not sent: " + failed.reason());
        scheduleEviction(s, token);
      }
    }
  }

  private void onRealtimeEvent(Session s, RealtimeEvent ev) {
    if (!isCurrent(s)) return;
    try {
      if (ev instanceof RealtimeEvent.MessageReceived received) {
        onMessageReceived(s, received.message());
      } else if (ev instanceof RealtimeEvent.StatusUpdated updated) {
        onStatusUpdated(s, updated.serverId(), updated.status());
      } else if (ev instanceof RealtimeEvent.CorrelationConfirmed confirmed) {
        onCorrelationConfirmed(s, confirmed.correlationToken(), confirmed.serverId());
      } else if (ev instanceof RealtimeEvent.ConnectionStateChanged changed) {
        connectionStates.onNext(changed.connected());
      } else if (ev instanceof RealtimeEvent.UserTyping typing) {
        if (typing.userId() != users.currentUserId()) typingEvents.onNext(typing);
      }
    } catch (RuntimeException e) {
      log.error("[solvix] Failed to apply {} to chat {}", ev, s.chatId, e);
    }
  }

  private void onMessageReceived(Session s, ChatMessage message) {
    ChatMessageStore.UpsertResult result = s.store.upsert(fromServer(message));
    ChatMessage stored = result.message();
    applyEarlyStatus(s, stored);
    if (!result.inserted()) return;
    summaries.onMessageInserted(stored, true);
    if (!stored.ownMessage() && stored.hasServerId() && users.isAuthenticated()) {
      markRead(s, List.of(stored.serverId()));
    }
  }

  private void onStatusUpdated(Session s, long serverId, MessageStatus status) {
    if (s.store.findByServerId(serverId).isEmpty()) {
      log.debug("[solvix] Buffering {} for unknown message {} in {}", status, serverId, s.chatId);
      s.earlyStatuses.remember(serverId, status);
      return;
    }
    advance(s, serverId, status);
  }

  private void onCorrelationConfirmed(Session s, String token, long serverId) {
    Optional<ChatMessage> attached = s.store.attachServerId(token, serverId);
    if (attached.isEmpty()) {
      log.debug("[solvix] Correlation {} -> {} matches no local message", token, serverId);
      return;
    }
    cancelEviction(s, token);
    long id = attached.get().serverId();
    advance(s, id, MessageStatus.SENT);
    s.store.findByServerId(id).ifPresent(m -> applyEarlyStatus(s, m));
  }

  private void markRead(Session s, Collection<Long> serverIds) {
    List<Long> marked = new ArrayList<>();
    for (Long id : serverIds) {
      if (id == null) continue;
      ChatMessage before = s.store.findByServerId(id).orElse(null);
      if (before == null || before.ownMessage() || before.read()) continue;
      if (advance(s, id, MessageStatus.READ)) marked.add(id);
    }
    if (marked.isEmpty()) return;
    s.disposables.add(
        receipts
            .markAsRead(s.chatId, marked)
            .observeOn(schedulers.reconcile())
            .subscribe(
                () ->
                    log.debug("[solvix] Reported {} read message(s) in {}", marked.size(), s.chatId),
                err -> {
                  log.warn("[solvix] Could not report read messages in {}", s.chatId, err);
                  notifications.showTransient(
                      NotificationKind.WARNING, s.chatId, "Read status will sync later.");
                }));
  }

  /** @return {@code true} when the message just became read */
  private boolean advance(Session s, long serverId, MessageStatus status) {
    Optional<ChatMessage> next = s.store.applyStatus(serverId, status);
    if (next.isEmpty()) return false;
    ChatMessage m = next.get();
    if (m.status() == MessageStatus.READ && status == MessageStatus.READ) {
      summaries.onMessageRead(m);
      return true;
    }
    return false;
  }

  private void applyEarlyStatus(Session s, ChatMessage m) {
    if (m == null || !m.hasServerId()) return;
    s.earlyStatuses.take(m.serverId()).ifPresent(status -> advance(s, m.serverId(), status));
  }

  private void scheduleEviction(Session s, String token) {
    RestartableRxTimer timer =
        s.evictions.computeIfAbsent(
            token,
            t ->
                new RestartableRxTimer(
                    schedulers.timer(),
                    err -> log.debug("[solvix] eviction timer error for {}", t, err)));
    timer.restart(
        props.failedMessageGracePeriod(),
        () -> schedulers.reconcile().scheduleDirect(() -> evict(s, token)));
  }

  private void cancelEviction(Session s, String token) {
    RestartableRxTimer timer = s.evictions.remove(token);
    if (timer != null) timer.close();
  }

  private void evict(Session s, String token) {
    cancelEviction(s, token);
    if (!isCurrent(s)) return;
    Optional<ChatMessage> entry = s.store.findByCorrelation(token);
    // a failed entry the server confirmed afterwards stays
    if (entry.isPresent()
        && entry.get().status() == MessageStatus.FAILED
        && entry.get().isOptimistic()) {
      s.store.removeByCorrelation(token);
      log.debug("[solvix] Evicted failed message {} from {}", token, s.chatId);
    }
  }

  /** Server messages are at least Sent. */
  private static ChatMessage fromServer(ChatMessage m) {
    if (m.hasServerId() && m.status() == MessageStatus.SENDING) {
      return m.withStatus(MessageStatus.SENT);
    }
    return m;
  }

  private boolean isCurrent(Session s) {
    return !s.closed && s.generation == generation;
  }

  private void teardown(Session s) {
    if (s == null) return;
    s.closed = true;
    if (s.subscription != null) s.subscription.close();
    s.disposables.dispose();
    for (RestartableRxTimer timer : s.evictions.values()) timer.close();
    s.evictions.clear();
    s.earlyStatuses.clear();
    log.debug("[solvix] Closed session #{} of chat {}", s.generation, s.chatId);
  }
}
