package dev.solvix.chatclient.app.api;

import dev.solvix.chatclient.model.ChatId;
import java.time.Instant;
import java.util.Objects;

/**
 * Short, non-blocking message for the user.
 *
 * @param chatId {@code null} when the notification is not tied to a chat
 */
public record TransientNotification(
    Instant at, NotificationKind kind, ChatId chatId, String message) {
  public TransientNotification {
    at = (at == null) ? Instant.now() : at;
    kind = Objects.requireNonNullElse(kind, NotificationKind.INFO);
    message = Objects.toString(message, "");
  }
}
