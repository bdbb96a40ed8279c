package dev.solvix.chatclient.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat session reconciliation settings.
 *
 */
@ConfigurationProperties(prefix = "solvix.chat")
public record ChatProperties(
    /** Messages fetched when a chat is opened. Default: 50. */
    Integer initialPageSize,

    /** Messages fetched per backward pagination step. Default: 30. */
    Integer pageSize,

    /** How long to wait for the real-time channel to accept a message. Default: 3s. */
    Duration realtimeSendTimeout,

    /** How long to wait for the request/response fallback. Default: 15s. */
    Duration apiSendTimeout,

    /** How long a failed optimistic message stays visible before it is evicted. Default: 5s. */
    Duration failedMessageGracePeriod,

    /**
     * Maximum {@code sentAt} distance for matching an optimistic message to a server message that
     * carries no correlation token. Default: 10s.
     */
    Duration identityMatchTolerance,

    /** Retention window for status updates that arrive before their message. */
    EarlyStatus earlyStatus
) {

  /** Buffering of status updates for server ids not yet known to the session. */
  public record EarlyStatus(
      /** Default: 2 minutes. */
      Duration retention,

      /** Hard cap on buffered ids per session. Default: 256. */
      Integer maxEntries
  ) {
    public EarlyStatus {
      if (retention == null || retention.isNegative() || retention.isZero()) {
        retention = Duration.ofMinutes(2);
      }
      if (maxEntries == null || maxEntries <= 0) maxEntries = 256;
    }
  }

  public ChatProperties {
    if (initialPageSize == null || initialPageSize <= 0) initialPageSize = 50;
    if (pageSize == null || pageSize <= 0) pageSize = 30;
    realtimeSendTimeout = positiveOr(realtimeSendTimeout, Duration.ofSeconds(3));
    apiSendTimeout = positiveOr(apiSendTimeout, Duration.ofSeconds(15));
    failedMessageGracePeriod = positiveOr(failedMessageGracePeriod, Duration.ofSeconds(5));
    identityMatchTolerance = positiveOr(identityMatchTolerance, Duration.ofSeconds(10));
    if (earlyStatus == null) earlyStatus = new EarlyStatus(null, null);
  }

  /** All defaults. */
  public static ChatProperties defaults() {
    return new ChatProperties(null, null, null, null, null, null, null);
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    if (value == null || value.isNegative() || value.isZero()) return fallback;
    return value;
  }
}
