package dev.solvix.chatclient.realtime;

import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

/**
 * Process-wide low-latency connection to the chat server.
 *
 * <p>One instance is shared by every chat session; sessions receive its {@link #events()} through
 * {@link RealtimeSubscriptionRegistry}.
 */
public interface RealtimeChannel {
  Flowable<RealtimeEvent> events();

  boolean isConnected();

  Completable connect();

  /**
   * Offer a message for delivery.
   *
   * <p>The message carries its correlation token so the server can confirm it with
   * {@link RealtimeEvent.CorrelationConfirmed}.
   *
   * @return {@code true} when the server accepted the message
   */
  Single<Boolean> send(ChatMessage message);

  Completable markAsRead(ChatId chatId, long serverId);

  default Completable sendTyping(ChatId chatId, boolean typing) {
    return Completable.complete();
  }
}
