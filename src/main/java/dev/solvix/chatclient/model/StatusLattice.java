package dev.solvix.chatclient.model;

import java.time.Instant;

/**
 * Monotonic transition rule for {@link MessageStatus}.
 *
 * <p>{@code SENDING < SENT < DELIVERED < READ}. {@code FAILED} can only be entered from
 * {@code SENDING} or {@code SENT} and is terminal.
 */
public final class StatusLattice {

  private StatusLattice() {}

  /** Resulting status after {@code incoming} is reported for a message currently at {@code current}. */
  public static MessageStatus apply(MessageStatus current, MessageStatus incoming) {
    if (incoming == null) return current;
    if (current == null) return incoming;
    if (current == MessageStatus.FAILED) return current;
    if (incoming == MessageStatus.FAILED) {
      return canFail(current) ? MessageStatus.FAILED : current;
    }
    return incoming.rank() > current.rank() ? incoming : current;
  }

  public static boolean canFail(MessageStatus current) {
    return current == MessageStatus.SENDING || current == MessageStatus.SENT;
  }

  /**
   * Applies {@code incoming} to a message snapshot.
   *
   * <p>Reaching {@link MessageStatus#READ} marks the message read; an existing {@code readAt} is
   * kept.
   *
   * @return {@code message} itself when nothing changed
   */
  public static ChatMessage advance(ChatMessage message, MessageStatus incoming, Instant now) {
    if (message == null) return null;
    MessageStatus next = apply(message.status(), incoming);
    ChatMessage out = (next == message.status()) ? message : message.withStatus(next);
    if (next == MessageStatus.READ && out.readAt() == null) {
      out = out.withRead(now != null ? now : Instant.now());
    }
    return out;
  }
}
