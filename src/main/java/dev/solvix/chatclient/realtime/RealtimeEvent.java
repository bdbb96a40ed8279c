package dev.solvix.chatclient.realtime;

import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.MessageStatus;
import java.time.Instant;
import java.util.Objects;

/** Inbound notification pushed by the real-time channel. */
public sealed interface RealtimeEvent permits
    RealtimeEvent.MessageReceived,
    RealtimeEvent.StatusUpdated,
    RealtimeEvent.CorrelationConfirmed,
    RealtimeEvent.ConnectionStateChanged,
    RealtimeEvent.UserTyping {

  /**
   * Chat this event belongs to.
   *
   * @return {@code null} for connection-wide events
   */
  ChatId chatId();

  record MessageReceived(Instant at, ChatMessage message) implements RealtimeEvent {
    public MessageReceived {
      Objects.requireNonNull(message, "message");
      at = (at == null) ? Instant.now() : at;
    }

    @Override
    public ChatId chatId() {
      return message.chatId();
    }
  }

  /** A delivery/read receipt for a message the server already identified. */
  record StatusUpdated(Instant at, ChatId chatId, long serverId, MessageStatus status)
      implements RealtimeEvent {
    public StatusUpdated {
      Objects.requireNonNull(chatId, "chatId");
      Objects.requireNonNull(status, "status");
      at = (at == null) ? Instant.now() : at;
    }
  }

  /** The server accepted the message sent with {@code correlationToken} as {@code serverId}. */
  record CorrelationConfirmed(Instant at, ChatId chatId, String correlationToken, long serverId)
      implements RealtimeEvent {
    public CorrelationConfirmed {
      Objects.requireNonNull(chatId, "chatId");
      correlationToken = Objects.toString(correlationToken, "").trim();
      at = (at == null) ? Instant.now() : at;
    }
  }

  record ConnectionStateChanged(Instant at, boolean connected) implements RealtimeEvent {
    public ConnectionStateChanged {
      at = (at == null) ? Instant.now() : at;
    }

    @Override
    public ChatId chatId() {
      return null;
    }
  }

  record UserTyping(Instant at, ChatId chatId, long userId, boolean typing)
      implements RealtimeEvent {
    public UserTyping {
      Objects.requireNonNull(chatId, "chatId");
      at = (at == null) ? Instant.now() : at;
    }
  }
}
