package dev.solvix.chatclient.app.outbound;

import dev.solvix.chatclient.model.ChatMessage;
import java.util.Objects;

/** Result of one delivery attempt for an optimistic message. */
public sealed interface DeliveryOutcome
    permits DeliveryOutcome.Accepted, DeliveryOutcome.Confirmed, DeliveryOutcome.Failed {

  String correlationToken();

  /**
   * The real-time channel took the message. Its server identity arrives later, by correlation
   * confirmation or by the pushed message itself.
   */
  record Accepted(String correlationToken) implements DeliveryOutcome {}

  /** The API stored the message and returned its server record, tagged with our token. */
  record Confirmed(String correlationToken, ChatMessage serverMessage) implements DeliveryOutcome {
    public Confirmed {
      Objects.requireNonNull(serverMessage, "serverMessage");
    }
  }

  record Failed(String correlationToken, String reason) implements DeliveryOutcome {
    public Failed {
      reason = Objects.toString(reason, "").trim();
    }
  }
}
