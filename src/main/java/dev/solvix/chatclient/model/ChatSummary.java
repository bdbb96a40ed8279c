package dev.solvix.chatclient.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Chat list entry derived from the messages of one chat.
 *
 * @param lastMessageTime {@code null} when the chat has no messages yet
 */
@ValueObject
public record ChatSummary(
    ChatId chatId,
    String title,
    String lastMessage,
    Instant lastMessageTime,
    int unreadCount
) {
  public ChatSummary {
    Objects.requireNonNull(chatId, "chatId");
    title = Objects.toString(title, "").trim();
    lastMessage = Objects.toString(lastMessage, "");
    if (unreadCount < 0) unreadCount = 0;
  }

  public static ChatSummary empty(ChatId chatId) {
    return new ChatSummary(chatId, "", "", null, 0);
  }

  public ChatSummary withLastMessage(String text, Instant at) {
    return new ChatSummary(chatId, title, text, at, unreadCount);
  }

  public ChatSummary withUnreadCount(int count) {
    return new ChatSummary(chatId, title, lastMessage, lastMessageTime, count);
  }
}
