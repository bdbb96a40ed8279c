package dev.solvix.chatclient.model;

/**
 * Delivery state of a chat message.
 *
 * <p>{@link #SENDING} through {@link #READ} form a chain ordered by {@link #rank()}. {@link #FAILED}
 * sits beside the chain; see {@link StatusLattice} for the transition rule.
 */
public enum MessageStatus {
  SENDING(0),
  SENT(1),
  DELIVERED(2),
  READ(3),
  FAILED(4);

  /** Wire code used by the server for an unknown/unset status. */
  public static final int UNKNOWN_CODE = -1;

  private final int code;

  MessageStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Position in the delivery chain. {@link #FAILED} has no position and reports {@code -1}. */
  public int rank() {
    return this == FAILED ? -1 : code;
  }

  public boolean isFailed() {
    return this == FAILED;
  }

  public boolean isAtLeast(MessageStatus other) {
    if (other == null) return true;
    if (this == FAILED || other == FAILED) return this == other;
    return code >= other.code;
  }

  /**
   * Maps a server status code.
   *
   * @return the status, or {@code null} for {@link #UNKNOWN_CODE} and unrecognized codes
   */
  public static MessageStatus fromCode(int code) {
    for (MessageStatus s : values()) {
      if (s.code == code) return s;
    }
    return null;
  }
}
