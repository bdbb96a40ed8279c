package dev.solvix.chatclient.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Snapshot of one chat message as displayed by a session.
 *
 * <p>Snapshots are immutable; reconciliation replaces them. {@code serverId == 0} means the server
 * has not assigned an identity yet, and an empty {@code correlationToken} means the message was
 * not originated by this client.
 */
@ValueObject
public record ChatMessage(
    String correlationToken,
    long serverId,
    ChatId chatId,
    long senderId,
    String senderName,
    String content,
    Instant sentAt,
    MessageStatus status,
    boolean read,
    Instant readAt,
    boolean ownMessage,
    boolean edited,
    Instant editedAt
) {
  public ChatMessage {
    Objects.requireNonNull(chatId, "chatId");
    correlationToken = Objects.toString(correlationToken, "").trim();
    if (serverId < 0) serverId = 0;
    senderName = Objects.toString(senderName, "").trim();
    content = Objects.toString(content, "");
    sentAt = (sentAt == null) ? Instant.now() : sentAt;
    status = (status == null) ? MessageStatus.SENDING : status;
    if (status == MessageStatus.READ) read = true;
    if (!read) readAt = null;
    if (!edited) editedAt = null;
  }

  /** A locally originated message that has not been confirmed by the server. */
  public static ChatMessage optimistic(
      String correlationToken, ChatId chatId, long senderId, String content, Instant sentAt) {
    return new ChatMessage(
        correlationToken,
        0L,
        chatId,
        senderId,
        "",
        content,
        sentAt,
        MessageStatus.SENDING,
        false,
        null,
        true,
        false,
        null);
  }

  /** A message as reported by the server (API page, send response or real-time push). */
  public static ChatMessage fromServer(
      long serverId,
      ChatId chatId,
      long senderId,
      String senderName,
      String content,
      Instant sentAt,
      MessageStatus status) {
    return new ChatMessage(
        "", serverId, chatId, senderId, senderName, content, sentAt, status, false, null, false,
        false, null);
  }

  public boolean hasServerId() {
    return serverId > 0;
  }

  public boolean hasCorrelationToken() {
    return !correlationToken.isEmpty();
  }

  /** Still waiting for the server to assign an identity. */
  public boolean isOptimistic() {
    return serverId <= 0;
  }

  public ChatMessage withCorrelationToken(String token) {
    return new ChatMessage(
        token, serverId, chatId, senderId, senderName, content, sentAt, status, read, readAt,
        ownMessage, edited, editedAt);
  }

  public ChatMessage withServerId(long id) {
    return new ChatMessage(
        correlationToken, id, chatId, senderId, senderName, content, sentAt, status, read, readAt,
        ownMessage, edited, editedAt);
  }

  public ChatMessage withContent(String text) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, senderName, text, sentAt, status, read,
        readAt, ownMessage, edited, editedAt);
  }

  public ChatMessage withSentAt(Instant at) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, senderName, content, at, status, read,
        readAt, ownMessage, edited, editedAt);
  }

  public ChatMessage withStatus(MessageStatus next) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, senderName, content, sentAt, next, read,
        readAt, ownMessage, edited, editedAt);
  }

  public ChatMessage withRead(Instant at) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, senderName, content, sentAt, status, true,
        at, ownMessage, edited, editedAt);
  }

  public ChatMessage withOwnMessage(boolean own) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, senderName, content, sentAt, status, read,
        readAt, own, edited, editedAt);
  }

  public ChatMessage withSenderName(String name) {
    return new ChatMessage(
        correlationToken, serverId, chatId, senderId, name, content, sentAt, status, read, readAt,
        ownMessage, edited, editedAt);
  }
}
