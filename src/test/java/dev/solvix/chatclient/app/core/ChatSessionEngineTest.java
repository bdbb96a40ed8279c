package dev.solvix.chatclient.app.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.solvix.chatclient.api.ChatApi;
import dev.solvix.chatclient.app.TransientNotificationBus;
import dev.solvix.chatclient.app.api.NotificationKind;
import dev.solvix.chatclient.app.api.TransientNotification;
import dev.solvix.chatclient.app.outbound.MessageDeliveryDispatcher;
import dev.solvix.chatclient.app.outbound.ReadReceiptDispatcher;
import dev.solvix.chatclient.app.state.ChatSummaryState;
import dev.solvix.chatclient.config.ChatProperties;
import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.ChatSummary;
import dev.solvix.chatclient.model.MessageStatus;
import dev.solvix.chatclient.realtime.RealtimeChannel;
import dev.solvix.chatclient.realtime.RealtimeEvent;
import dev.solvix.chatclient.realtime.RealtimeSubscriptionRegistry;
import dev.solvix.chatclient.util.ChatSchedulers;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.processors.PublishProcessor;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subjects.SingleSubject;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatSessionEngineTest {

  private static final String RAW_CHAT = "3f1c2a7e-5b9d-4e21-8a6f-0c4d2b1e9f77";
  private static final String RAW_OTHER = "11111111-2222-4333-8444-555555555555";
  private static final ChatId CHAT = ChatId.parse(RAW_CHAT);
  private static final ChatId OTHER = ChatId.parse(RAW_OTHER);
  private static final long ME = 1L;
  private static final long BOB = 2L;
  // Dispatcher timestamps come from the test scheduler, which starts at the epoch.
  private static final Instant T0 = Instant.EPOCH;

  private final PublishProcessor<RealtimeEvent> events = PublishProcessor.create();
  private final RealtimeChannel realtime = mock(RealtimeChannel.class);
  private final ChatApi api = mock(ChatApi.class);
  private final AtomicLong currentUser = new AtomicLong(ME);
  private final TestScheduler timer = new TestScheduler();
  private final ChatSchedulers schedulers =
      new ChatSchedulers(Schedulers.trampoline(), Schedulers.trampoline(), timer);
  private final ChatProperties props = ChatProperties.defaults();
  private final TransientNotificationBus notifications = new TransientNotificationBus();
  private final ChatSummaryState summaries = new ChatSummaryState();
  private final RealtimeSubscriptionRegistry registry = new RealtimeSubscriptionRegistry(realtime);

  private ChatSessionEngine engine;
  private TestSubscriber<TransientNotification> notices;

  @BeforeEach
  void setUp() {
    when(realtime.events()).thenReturn(events);
    when(realtime.isConnected()).thenReturn(true);
    when(realtime.connect()).thenReturn(Completable.complete());
    when(realtime.markAsRead(any(), anyLong())).thenReturn(Completable.complete());
    when(api.getChat(any())).thenReturn(Maybe.empty());
    when(api.getMessages(any(), anyInt(), anyInt())).thenReturn(Single.just(List.of()));
    when(api.markAsRead(any(), any())).thenReturn(Completable.complete());

    engine = newEngine(schedulers);
    notices = notifications.notifications().test();
  }

  @AfterEach
  void tearDown() {
    engine.close();
    registry.shutdown();
  }

  @Test
  void realtimeFailureFallsBackToApiAndLeavesOneSentEntry() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.send(any())).thenReturn(Single.error(new IOException("socket closed")));
    Instant serverTime = T0.plusSeconds(1);
    when(api.sendMessage(CHAT, "hi"))
        .thenReturn(Maybe.just(ChatMessage.fromServer(42, CHAT, ME, "me", "hi", serverTime, MessageStatus.SENT)));

    ChatMessage optimistic = engine.send("hi").orElseThrow();

    assertEquals(MessageStatus.SENDING, optimistic.status());
    assertThat(engine.messages()).hasSize(1);
    ChatMessage only = engine.messages().get(0);
    assertEquals(42, only.serverId());
    assertEquals(MessageStatus.SENT, only.status());
    assertEquals("hi", only.content());
    assertEquals(optimistic.correlationToken(), only.correlationToken());
    assertTrue(only.ownMessage());
  }

  @Test
  void pushedEchoWithoutTokenMergesIntoOptimisticEntry() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.send(any())).thenReturn(Single.never());
    ChatMessage optimistic = engine.send("same words").orElseThrow();

    events.onNext(
        new RealtimeEvent.MessageReceived(
            null,
            ChatMessage.fromServer(
                7, CHAT, ME, "me", "same words", optimistic.sentAt().plusSeconds(2), MessageStatus.SENT)));

    assertThat(engine.messages()).hasSize(1);
    assertEquals(7, engine.messages().get(0).serverId());
    assertEquals(optimistic.correlationToken(), engine.messages().get(0).correlationToken());
  }

  @Test
  void outOfOrderReceiptsEndAtRead() {
    when(api.getMessages(CHAT, 0, 50))
        .thenReturn(Single.just(List.of(ChatMessage.fromServer(7, CHAT, ME, "me", "yo", T0, MessageStatus.SENT))));
    engine.open(RAW_CHAT).test().assertComplete();

    events.onNext(new RealtimeEvent.StatusUpdated(null, CHAT, 7, MessageStatus.READ));
    events.onNext(new RealtimeEvent.StatusUpdated(null, CHAT, 7, MessageStatus.DELIVERED));

    ChatMessage m = engine.messages().get(0);
    assertEquals(MessageStatus.READ, m.status());
    assertTrue(m.read());
  }

  @Test
  void failedSendIsShownThenEvictedAfterGracePeriod() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.send(any())).thenReturn(Single.error(new IOException("socket closed")));
    when(api.sendMessage(CHAT, "lost")).thenReturn(Maybe.error(new IOException("503")));

    engine.send("lost");

    assertEquals(MessageStatus.FAILED, engine.messages().get(0).status());
    assertTrue(notices.values().stream().anyMatch(n -> n.kind() == NotificationKind.ERROR));

    timer.advanceTimeBy(4, TimeUnit.SECONDS);
    assertThat(engine.messages()).hasSize(1);

    timer.advanceTimeBy(1, TimeUnit.SECONDS);
    assertThat(engine.messages()).isEmpty();
  }

  @Test
  void retryReplacesFailedEntryWithNewToken() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.isConnected()).thenReturn(false);
    when(api.sendMessage(CHAT, "again"))
        .thenReturn(Maybe.error(new IOException("503")))
        .thenReturn(Maybe.just(ChatMessage.fromServer(43, CHAT, ME, "me", "again", T0, MessageStatus.SENT)));
    ChatMessage failed = engine.send("again").orElseThrow();
    assertEquals(MessageStatus.FAILED, engine.messages().get(0).status());

    ChatMessage resent = engine.retry(failed.correlationToken()).orElseThrow();

    assertNotEquals(failed.correlationToken(), resent.correlationToken());
    assertThat(engine.messages()).hasSize(1);
    assertEquals(43, engine.messages().get(0).serverId());
    timer.advanceTimeBy(10, TimeUnit.SECONDS);
    assertThat(engine.messages()).hasSize(1);
  }

  @Test
  void confirmationAfterFailureKeepsFailed() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.isConnected()).thenReturn(false);
    when(api.sendMessage(CHAT, "late")).thenReturn(Maybe.empty());
    ChatMessage failed = engine.send("late").orElseThrow();

    events.onNext(new RealtimeEvent.CorrelationConfirmed(null, CHAT, failed.correlationToken(), 88));

    ChatMessage m = engine.messages().get(0);
    assertEquals(88, m.serverId());
    assertEquals(MessageStatus.FAILED, m.status());

    timer.advanceTimeBy(6, TimeUnit.SECONDS);
    assertThat(engine.messages()).hasSize(1);
    assertEquals(88, engine.messages().get(0).serverId());
  }

  @Test
  void failedEntryConfirmedByPushedCopySurvivesGracePeriod() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.isConnected()).thenReturn(false);
    when(api.sendMessage(CHAT, "late")).thenReturn(Maybe.empty());
    ChatMessage failed = engine.send("late").orElseThrow();

    events.onNext(
        new RealtimeEvent.MessageReceived(
            null,
            ChatMessage.fromServer(89, CHAT, ME, "me", "late", T0, MessageStatus.SENT)
                .withCorrelationToken(failed.correlationToken())));
    timer.advanceTimeBy(6, TimeUnit.SECONDS);

    assertThat(engine.messages()).hasSize(1);
    ChatMessage m = engine.messages().get(0);
    assertEquals(89, m.serverId());
    assertEquals(MessageStatus.FAILED, m.status());
  }

  @Test
  void statusArrivingBeforeConfirmationIsAppliedOnConfirmation() {
    engine.open(RAW_CHAT).test().assertComplete();
    when(realtime.send(any())).thenReturn(Single.just(true));
    ChatMessage sent = engine.send("quick").orElseThrow();
    assertEquals(MessageStatus.SENT, engine.messages().get(0).status());

    events.onNext(new RealtimeEvent.StatusUpdated(null, CHAT, 55, MessageStatus.DELIVERED));
    events.onNext(new RealtimeEvent.CorrelationConfirmed(null, CHAT, sent.correlationToken(), 55));

    ChatMessage m = engine.messages().get(0);
    assertEquals(55, m.serverId());
    assertEquals(MessageStatus.DELIVERED, m.status());
  }

  @Test
  void incomingMessageIsMarkedReadAndReported() {
    when(realtime.isConnected()).thenReturn(false);
    engine.open(RAW_CHAT).test().assertComplete();

    events.onNext(
        new RealtimeEvent.MessageReceived(
            null, ChatMessage.fromServer(9, CHAT, BOB, "bob", "ping", T0, MessageStatus.SENT)));

    ChatMessage m = engine.messages().get(0);
    assertEquals(MessageStatus.READ, m.status());
    assertFalse(m.ownMessage());
    verify(api).markAsRead(CHAT, List.of(9L));
    assertEquals(0, summaries.get(CHAT).orElseThrow().unreadCount());
    assertEquals("ping", summaries.get(CHAT).orElseThrow().lastMessage());
  }

  @Test
  void openingLoadsFirstPageSeedsSummaryAndReadsVisibleMessages() {
    when(api.getChat(CHAT)).thenReturn(Maybe.just(new ChatSummary(CHAT, "Bob", "", null, 1)));
    when(api.getMessages(CHAT, 0, 50))
        .thenReturn(
            Single.just(
                List.of(
                    ChatMessage.fromServer(2, CHAT, BOB, "bob", "second", T0.plusSeconds(2), MessageStatus.SENT),
                    ChatMessage.fromServer(1, CHAT, ME, "me", "first", T0.plusSeconds(1), MessageStatus.SENT))));

    engine.open(RAW_CHAT).test().assertComplete();

    assertEquals(ChatSessionState.READY, engine.state());
    assertThat(engine.messages()).extracting(ChatMessage::content).containsExactly("first", "second");
    assertFalse(engine.canLoadMore());
    verify(realtime).markAsRead(CHAT, 2L);
    ChatSummary summary = summaries.get(CHAT).orElseThrow();
    assertEquals("Bob", summary.title());
    assertEquals(0, summary.unreadCount());
  }

  @Test
  void reopeningSameChatReturnsInFlightInitialization() {
    SingleSubject<List<ChatMessage>> firstPage = SingleSubject.create();
    when(api.getMessages(CHAT, 0, 50)).thenReturn(firstPage);

    Completable a = engine.open(RAW_CHAT);
    Completable b = engine.open(" " + RAW_CHAT + " ");

    assertSame(a, b);
    assertEquals(ChatSessionState.LOADING, engine.state());
    firstPage.onSuccess(List.of());
    a.test().assertComplete();
    verify(api, times(1)).getMessages(CHAT, 0, 50);
  }

  @Test
  void concurrentOlderLoadsShareOneRequest() {
    when(api.getMessages(CHAT, 0, 50)).thenReturn(Single.just(page(1, 50, ME)));
    engine.open(RAW_CHAT).test().assertComplete();
    assertTrue(engine.canLoadMore());
    SingleSubject<List<ChatMessage>> older = SingleSubject.create();
    when(api.getMessages(CHAT, 50, 30)).thenReturn(older);

    Completable first = engine.loadOlderMessages();
    Completable second = engine.loadOlderMessages();

    assertSame(first, second);
    verify(api, times(1)).getMessages(CHAT, 50, 30);

    older.onSuccess(page(-29, 30, ME));
    first.test().assertComplete();
    assertThat(engine.messages()).hasSize(80);
    assertTrue(engine.canLoadMore());

    when(api.getMessages(CHAT, 80, 30)).thenReturn(Single.just(page(-40, 5, ME)));
    engine.loadOlderMessages().test().assertComplete();
    assertThat(engine.messages()).hasSize(85);
    assertFalse(engine.canLoadMore());
    assertThat(engine.messages()).isSortedAccordingTo((x, y) -> x.sentAt().compareTo(y.sentAt()));
  }

  @Test
  void switchingChatsDiscardsInFlightPageOfPreviousChat() {
    when(api.getMessages(CHAT, 0, 50)).thenReturn(Single.just(page(1, 50, ME)));
    engine.open(RAW_CHAT).test().assertComplete();
    SingleSubject<List<ChatMessage>> older = SingleSubject.create();
    when(api.getMessages(CHAT, 50, 30)).thenReturn(older);
    engine.loadOlderMessages();

    List<ChatMessage> otherPage =
        List.of(ChatMessage.fromServer(500, OTHER, ME, "me", "other chat", T0, MessageStatus.SENT));
    when(api.getMessages(OTHER, 0, 50)).thenReturn(Single.just(otherPage));
    engine.open(RAW_OTHER).test().assertComplete();
    older.onSuccess(page(-29, 30, ME));

    assertEquals(OTHER, engine.currentChatId().orElseThrow());
    assertThat(engine.messages()).extracting(ChatMessage::serverId).containsExactly(500L);
    assertEquals(1, registry.subscriberCount());
    assertEquals(1, registry.subscriberCount(OTHER));
  }

  @Test
  void invalidChatReferenceCreatesNoSession() {
    engine.open("chat-42").test().assertComplete();

    assertEquals(ChatSessionState.IDLE, engine.state());
    assertTrue(engine.currentChatId().isEmpty());
    assertEquals(0, registry.subscriberCount());
    verify(api, never()).getMessages(any(), anyInt(), anyInt());
    assertEquals(NotificationKind.ERROR, notices.values().get(0).kind());
  }

  @Test
  void signedOutUserCanReadButNotSendOrMarkRead() {
    currentUser.set(0);
    when(api.getMessages(CHAT, 0, 50))
        .thenReturn(Single.just(List.of(ChatMessage.fromServer(3, CHAT, BOB, "bob", "hey", T0, MessageStatus.SENT))));

    engine.open(RAW_CHAT).test().assertComplete();
    assertTrue(engine.send("hello?").isEmpty());
    engine.markVisibleAsRead(List.of(3L));

    assertThat(engine.messages()).hasSize(1);
    assertFalse(engine.messages().get(0).read());
    verify(realtime, never()).send(any());
    verify(api, never()).markAsRead(any(), any());
    assertTrue(notices.values().stream().allMatch(n -> n.kind() == NotificationKind.AUTH));
    assertThat(notices.values()).hasSize(3);
  }

  @Test
  void markVisibleAsReadAppliesOnReconcileScheduler() {
    TestScheduler reconcile = new TestScheduler();
    ChatSessionEngine queued =
        newEngine(new ChatSchedulers(reconcile, Schedulers.trampoline(), timer));
    currentUser.set(0);
    when(api.getMessages(CHAT, 0, 50))
        .thenReturn(Single.just(List.of(ChatMessage.fromServer(3, CHAT, BOB, "bob", "hey", T0, MessageStatus.SENT))));
    try {
      queued.open(RAW_CHAT);
      reconcile.triggerActions();
      assertEquals(ChatSessionState.READY, queued.state());
      currentUser.set(ME);

      queued.markVisibleAsRead(List.of(3L));

      assertFalse(queued.messages().get(0).read());
      verify(realtime, never()).markAsRead(any(), anyLong());

      reconcile.triggerActions();

      assertTrue(queued.messages().get(0).read());
      verify(realtime).markAsRead(CHAT, 3L);
    } finally {
      queued.close();
    }
  }

  @Test
  void blankInputIsIgnored() {
    engine.open(RAW_CHAT).test().assertComplete();

    assertTrue(engine.send("   ").isEmpty());
    assertThat(engine.messages()).isEmpty();
    verify(api, never()).sendMessage(any(), anyString());
  }

  @Test
  void failedReadReceiptKeepsLocalReadState() {
    when(realtime.isConnected()).thenReturn(false);
    when(api.markAsRead(any(), any())).thenReturn(Completable.error(new IOException("503")));
    when(api.getMessages(CHAT, 0, 50))
        .thenReturn(Single.just(List.of(ChatMessage.fromServer(3, CHAT, BOB, "bob", "hey", T0, MessageStatus.SENT))));

    engine.open(RAW_CHAT).test().assertComplete();

    assertTrue(engine.messages().get(0).read());
    assertTrue(notices.values().stream().anyMatch(n -> n.kind() == NotificationKind.WARNING));
  }

  @Test
  void connectionAndTypingEventsArePublished() {
    engine.open(RAW_CHAT).test().assertComplete();
    TestSubscriber<Boolean> connection = engine.connectionStates().test();
    TestSubscriber<RealtimeEvent.UserTyping> typing = engine.typingEvents().test();

    events.onNext(new RealtimeEvent.ConnectionStateChanged(null, false));
    events.onNext(new RealtimeEvent.UserTyping(null, CHAT, BOB, true));
    events.onNext(new RealtimeEvent.UserTyping(null, CHAT, ME, true));

    connection.assertValues(true, false);
    typing.assertValueCount(1);
  }

  @Test
  void setTypingForwardsOnlyChanges() {
    when(realtime.sendTyping(any(), anyBoolean())).thenReturn(Completable.complete());
    engine.open(RAW_CHAT).test().assertComplete();

    engine.setTyping(true);
    engine.setTyping(true);
    engine.setTyping(false);

    verify(realtime, times(1)).sendTyping(CHAT, true);
    verify(realtime, times(1)).sendTyping(CHAT, false);
  }

  @Test
  void closeStopsListeningAndIsIdempotent() {
    engine.open(RAW_CHAT).test().assertComplete();
    TestSubscriber<?> changes = engine.changes().test();

    engine.close();
    engine.close();
    events.onNext(
        new RealtimeEvent.MessageReceived(
            null, ChatMessage.fromServer(9, CHAT, BOB, "bob", "late", T0, MessageStatus.SENT)));

    assertEquals(ChatSessionState.CLOSED, engine.state());
    assertEquals(0, registry.subscriberCount());
    assertThat(engine.messages()).isEmpty();
    changes.assertNoValues();
  }

  private ChatSessionEngine newEngine(ChatSchedulers chatSchedulers) {
    return new ChatSessionEngine(
        registry,
        realtime,
        api,
        currentUser::get,
        new MessageDeliveryDispatcher(realtime, api, props, chatSchedulers),
        new ReadReceiptDispatcher(realtime, api, props, chatSchedulers),
        summaries,
        notifications,
        props,
        chatSchedulers,
        Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
  }

  private static List<ChatMessage> page(int firstSecond, int count, long sender) {
    List<ChatMessage> out = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      long id = 1000L + firstSecond + i;
      out.add(
          ChatMessage.fromServer(
              id, CHAT, sender, "", "m" + id, T0.plusSeconds(firstSecond + i), MessageStatus.SENT));
    }
    return out;
  }
}
