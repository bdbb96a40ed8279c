package dev.solvix.chatclient.model;

import java.util.Objects;
import java.util.UUID;
import org.jmolecules.ddd.annotation.ValueObject;

/** Identifies one conversation. */
@ValueObject
public record ChatId(UUID value) {
  public ChatId {
    Objects.requireNonNull(value, "value");
    if (value.getMostSignificantBits() == 0L && value.getLeastSignificantBits() == 0L) {
      throw new InvalidChatReferenceException("00000000-0000-0000-0000-000000000000");
    }
  }

  /**
   * Parses a chat reference as received from navigation or a push payload.
   *
   * @throws InvalidChatReferenceException if {@code raw} is blank, not a UUID, or the empty UUID
   */
  public static ChatId parse(String raw) {
    String s = Objects.toString(raw, "").trim();
    if (s.isEmpty()) throw new InvalidChatReferenceException(s);
    final UUID uuid;
    try {
      uuid = UUID.fromString(s);
    } catch (IllegalArgumentException e) {
      throw new InvalidChatReferenceException(s, e);
    }
    // UUID.fromString accepts short groups like "1-2-3-4-5"; only the canonical form is a chat id.
    if (!uuid.toString().equalsIgnoreCase(s)) throw new InvalidChatReferenceException(s);
    return new ChatId(uuid);
  }

  public static ChatId of(UUID value) {
    return new ChatId(value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
