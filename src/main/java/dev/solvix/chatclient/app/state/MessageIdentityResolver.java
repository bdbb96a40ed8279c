package dev.solvix.chatclient.app.state;

import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.MessageStatus;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the stored message an incoming snapshot refers to.
 *
 * <p>Order: correlation token, then server id, then a content/time heuristic for server messages
 * that come back without the token of their optimistic placeholder. Stateless.
 */
public final class MessageIdentityResolver {

  private final Duration tolerance;

  public MessageIdentityResolver(Duration tolerance) {
    this.tolerance =
        (tolerance == null || tolerance.isNegative()) ? Duration.ofSeconds(10) : tolerance;
  }

  public Duration tolerance() {
    return tolerance;
  }

  public Optional<ChatMessage> resolve(Iterable<ChatMessage> existing, ChatMessage incoming) {
    if (existing == null || incoming == null) return Optional.empty();

    if (incoming.hasCorrelationToken()) {
      for (ChatMessage m : existing) {
        if (incoming.correlationToken().equals(m.correlationToken())) return Optional.of(m);
      }
    }

    if (incoming.hasServerId()) {
      for (ChatMessage m : existing) {
        if (m.serverId() == incoming.serverId()) return Optional.of(m);
      }
    }

    ChatMessage best = null;
    long bestDistance = Long.MAX_VALUE;
    for (ChatMessage m : existing) {
      if (!isHeuristicMatch(m, incoming)) continue;
      long distance = distanceMillis(m, incoming);
      if (distance < bestDistance) {
        best = m;
        bestDistance = distance;
      }
    }
    return Optional.ofNullable(best);
  }

  boolean isHeuristicMatch(ChatMessage candidate, ChatMessage incoming) {
    if (!candidate.isOptimistic() || candidate.status() == MessageStatus.FAILED) return false;
    if (candidate == incoming) return false;
    if (candidate.hasCorrelationToken()
        && incoming.hasCorrelationToken()
        && !candidate.correlationToken().equals(incoming.correlationToken())) {
      return false;
    }
    if (!Objects.equals(candidate.chatId(), incoming.chatId())) return false;
    if (candidate.senderId() != incoming.senderId()) return false;
    if (!candidate.content().equals(incoming.content())) return false;
    return distanceMillis(candidate, incoming) <= tolerance.toMillis();
  }

  private static long distanceMillis(ChatMessage a, ChatMessage b) {
    return Math.abs(Duration.between(a.sentAt(), b.sentAt()).toMillis());
  }
}
