package dev.solvix.chatclient.app.state;

import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.ChatSummary;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Chat list summaries kept in step with the messages sessions observe.
 *
 * <p>The last message only moves forward in time. Unread counts are seeded from the server and
 * then adjusted by live traffic and local reads; they never drop below zero.
 */
@Component
public class ChatSummaryState {

  private final Map<ChatId, ChatSummary> summaries = new ConcurrentHashMap<>();
  private final FlowableProcessor<ChatSummary> changes =
      PublishProcessor.<ChatSummary>create().toSerialized();

  public Optional<ChatSummary> get(ChatId chatId) {
    if (chatId == null) return Optional.empty();
    return Optional.ofNullable(summaries.get(chatId));
  }

  public List<ChatSummary> snapshot() {
    return List.copyOf(summaries.values());
  }

  public Flowable<ChatSummary> changes() {
    return changes.onBackpressureBuffer();
  }

  /** Stores server-provided details. A newer last message already known locally is kept. */
  public ChatSummary seed(ChatSummary fromServer) {
    Objects.requireNonNull(fromServer, "fromServer");
    ChatSummary next =
        summaries.merge(
            fromServer.chatId(),
            fromServer,
            (prev, seeded) -> {
              if (prev.lastMessageTime() != null
                  && (seeded.lastMessageTime() == null
                      || prev.lastMessageTime().isAfter(seeded.lastMessageTime()))) {
                return seeded.withLastMessage(prev.lastMessage(), prev.lastMessageTime());
              }
              return seeded;
            });
    changes.onNext(next);
    return next;
  }

  /** Registers the chat without server details when none are available. */
  public ChatSummary ensure(ChatId chatId) {
    return summaries.computeIfAbsent(chatId, ChatSummary::empty);
  }

  /**
   * Accounts for a message newly added to a chat.
   *
   * @param countUnread whether an unread incoming message raises the unread count; history pages
   *     are already reflected in the seeded count
   */
  public ChatSummary onMessageInserted(ChatMessage message, boolean countUnread) {
    Objects.requireNonNull(message, "message");
    ChatSummary next =
        summaries.compute(
            message.chatId(),
            (id, prev) -> {
              ChatSummary s = (prev != null) ? prev : ChatSummary.empty(id);
              if (s.lastMessageTime() == null || !message.sentAt().isBefore(s.lastMessageTime())) {
                s = s.withLastMessage(message.content(), message.sentAt());
              }
              if (countUnread && !message.ownMessage() && !message.read()) {
                s = s.withUnreadCount(s.unreadCount() + 1);
              }
              return s;
            });
    changes.onNext(next);
    return next;
  }

  /** Accounts for an incoming message that just became read. */
  public ChatSummary onMessageRead(ChatMessage message) {
    Objects.requireNonNull(message, "message");
    if (message.ownMessage()) return summaries.get(message.chatId());
    ChatSummary next =
        summaries.compute(
            message.chatId(),
            (id, prev) -> {
              ChatSummary s = (prev != null) ? prev : ChatSummary.empty(id);
              return s.withUnreadCount(s.unreadCount() - 1);
            });
    changes.onNext(next);
    return next;
  }
}
