package dev.solvix.chatclient.app.state;

import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.MessageStatus;
import dev.solvix.chatclient.model.StatusLattice;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, deduplicating message list of one chat.
 *
 * <p>Messages are kept sorted by {@code sentAt}, ties in insertion order. No two entries share a
 * non-empty correlation token or a positive server id: every write goes through the
 * {@link MessageIdentityResolver} and merges into the entry it resolves to.
 */
public class ChatMessageStore {
  private static final Logger log = LoggerFactory.getLogger(ChatMessageStore.class);

  public enum ChangeKind {
    INSERTED,
    UPDATED,
    REMOVED,
    /**
     * A page of history was merged; {@code messages} holds every inserted or updated entry.
     * Entries folded into another one during the merge are reported as {@code REMOVED} first.
     */
    PAGE_MERGED
  }

  public record Change(ChatId chatId, ChangeKind kind, List<ChatMessage> messages) {
    public Change {
      messages = List.copyOf(messages);
    }
  }

  /**
   * Result of {@link #upsert(ChatMessage)}.
   *
   * @param message the stored snapshot after the write
   * @param inserted {@code true} when no existing entry matched
   * @param changed {@code false} when the write was a no-op
   */
  public record UpsertResult(ChatMessage message, boolean inserted, boolean changed) {}

  private static final class Slot {
    private final long seq;
    private ChatMessage message;

    private Slot(long seq, ChatMessage message) {
      this.seq = seq;
      this.message = message;
    }
  }

  private final ChatId chatId;
  private final MessageIdentityResolver resolver;
  private final LongSupplier currentUserId;
  private final Clock clock;
  private final List<Slot> slots = new ArrayList<>();
  private final List<ChatMessage> view = new SlotView();
  private final FlowableProcessor<Change> changes = PublishProcessor.<Change>create().toSerialized();
  private long nextSeq;

  public ChatMessageStore(
      ChatId chatId, MessageIdentityResolver resolver, LongSupplier currentUserId) {
    this(chatId, resolver, currentUserId, Clock.systemUTC());
  }

  public ChatMessageStore(
      ChatId chatId, MessageIdentityResolver resolver, LongSupplier currentUserId, Clock clock) {
    this.chatId = Objects.requireNonNull(chatId, "chatId");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.currentUserId = Objects.requireNonNull(currentUserId, "currentUserId");
    this.clock = Objects.requireNonNullElse(clock, Clock.systemUTC());
  }

  public ChatId chatId() {
    return chatId;
  }

  public Flowable<Change> changes() {
    return changes.onBackpressureBuffer();
  }

  public synchronized UpsertResult upsert(ChatMessage incoming) {
    UpsertResult result = upsertLocked(incoming);
    if (result.changed()) {
      emit(result.inserted() ? ChangeKind.INSERTED : ChangeKind.UPDATED, result.message());
    }
    return result;
  }

  /**
   * Merges a page of older messages as one batch.
   *
   * @return the entries that were not in the store before
   */
  public synchronized List<ChatMessage> prepend(List<ChatMessage> olderMessages) {
    if (olderMessages == null || olderMessages.isEmpty()) return List.of();
    List<ChatMessage> inserted = new ArrayList<>();
    List<ChatMessage> touched = new ArrayList<>();
    for (ChatMessage m : olderMessages) {
      if (m == null) continue;
      UpsertResult r = upsertLocked(m);
      if (!r.changed()) continue;
      touched.add(r.message());
      if (r.inserted()) inserted.add(r.message());
    }
    if (!touched.isEmpty()) {
      changes.onNext(new Change(chatId, ChangeKind.PAGE_MERGED, touched));
    }
    return inserted;
  }

  public synchronized Optional<ChatMessage> removeByCorrelation(String correlationToken) {
    Slot slot = slotByCorrelation(correlationToken);
    if (slot == null) return Optional.empty();
    slots.remove(slot);
    emit(ChangeKind.REMOVED, slot.message);
    return Optional.of(slot.message);
  }

  /**
   * Applies a status report to the entry holding {@code serverId}.
   *
   * @return the new snapshot, or empty when the id is unknown or the status did not move
   */
  public synchronized Optional<ChatMessage> applyStatus(long serverId, MessageStatus status) {
    return advance(slotByServerId(serverId), status);
  }

  public synchronized Optional<ChatMessage> applyStatusByCorrelation(
      String correlationToken, MessageStatus status) {
    return advance(slotByCorrelation(correlationToken), status);
  }

  /**
   * Gives the optimistic entry {@code correlationToken} its server identity.
   *
   * <p>When another entry already holds {@code serverId}, the two describe the same message: the
   * server record survives and absorbs the token and the status of the optimistic one.
   *
   * @return the entry now holding {@code serverId}, or empty when the token is unknown
   */
  public synchronized Optional<ChatMessage> attachServerId(String correlationToken, long serverId) {
    if (serverId <= 0) return Optional.empty();
    Slot slot = slotByCorrelation(correlationToken);
    if (slot == null) return Optional.empty();

    ChatMessage current = slot.message;
    if (current.serverId() == serverId) return Optional.of(current);
    if (current.hasServerId()) {
      log.warn(
          "[solvix] Ignoring server id {} for token {} in chat {}: entry already has server id {}",
          serverId, current.correlationToken(), chatId, current.serverId());
      return Optional.of(current);
    }

    Slot holder = slotByServerId(serverId);
    if (holder != null) {
      return Optional.of(mergeInto(holder, slot, current));
    }

    ChatMessage next = current.withServerId(serverId);
    replace(slot, next);
    emit(ChangeKind.UPDATED, next);
    return Optional.of(next);
  }

  public synchronized Optional<ChatMessage> findByServerId(long serverId) {
    Slot slot = slotByServerId(serverId);
    return slot == null ? Optional.empty() : Optional.of(slot.message);
  }

  public synchronized Optional<ChatMessage> findByCorrelation(String correlationToken) {
    Slot slot = slotByCorrelation(correlationToken);
    return slot == null ? Optional.empty() : Optional.of(slot.message);
  }

  /** Immutable copy in display order. */
  public synchronized List<ChatMessage> snapshot() {
    return List.copyOf(view);
  }

  public synchronized int size() {
    return slots.size();
  }

  /** Server ids of messages from other users that are not read yet. */
  public synchronized List<Long> unreadIncomingServerIds() {
    List<Long> out = new ArrayList<>();
    for (Slot s : slots) {
      ChatMessage m = s.message;
      if (!m.ownMessage() && m.hasServerId() && !m.read()) out.add(m.serverId());
    }
    return out;
  }

  private UpsertResult upsertLocked(ChatMessage incoming) {
    Objects.requireNonNull(incoming, "incoming");
    if (!chatId.equals(incoming.chatId())) {
      throw new IllegalArgumentException(
          "Message of chat " + incoming.chatId() + " does not belong to store of chat " + chatId);
    }
    ChatMessage normalized = withOwnership(incoming);
    Optional<ChatMessage> match = resolver.resolve(view, normalized);
    if (match.isEmpty()) {
      ChatMessage stored = stampRead(normalized);
      insert(new Slot(nextSeq++, stored));
      return new UpsertResult(stored, true, true);
    }

    Slot slot = slotOf(match.get());
    ChatMessage existing = slot.message;
    ChatMessage merged = merge(existing, normalized);

    if (merged.hasServerId() && !existing.hasServerId()) {
      Slot holder = slotByServerId(merged.serverId());
      if (holder != null && holder != slot) {
        ChatMessage survivor = absorb(holder.message, merged);
        slots.remove(slot);
        emit(ChangeKind.REMOVED, existing);
        replace(holder, survivor);
        log.debug(
            "[solvix] Merged optimistic message {} into server record {} in chat {}",
            existing.correlationToken(), survivor.serverId(), chatId);
        return new UpsertResult(survivor, false, true);
      }
    }

    if (merged.equals(existing)) return new UpsertResult(existing, false, false);
    replace(slot, merged);
    return new UpsertResult(merged, false, true);
  }

  private ChatMessage merge(ChatMessage existing, ChatMessage incoming) {
    ChatMessage out = existing;
    if (!out.hasCorrelationToken() && incoming.hasCorrelationToken()) {
      out = out.withCorrelationToken(incoming.correlationToken());
    }

    if (existing.isOptimistic()) {
      if (incoming.hasServerId()) {
        out = out.withServerId(incoming.serverId());
        if (!incoming.content().equals(out.content())) out = out.withContent(incoming.content());
        // sentAt never moves backward
        if (incoming.sentAt().isAfter(out.sentAt())) out = out.withSentAt(incoming.sentAt());
      }
    } else if (!incoming.content().equals(existing.content())) {
      log.warn(
          "[solvix] Content conflict for message {} in chat {}; keeping first-seen content",
          existing.serverId(), chatId);
    }

    if (out.senderName().isEmpty() && !incoming.senderName().isEmpty()) {
      out = out.withSenderName(incoming.senderName());
    }

    Instant readAt = incoming.readAt() != null ? incoming.readAt() : clock.instant();
    out = StatusLattice.advance(out, incoming.status(), readAt);
    if (incoming.read() && !out.read()) {
      out = StatusLattice.advance(out, MessageStatus.READ, readAt);
    }
    return out;
  }

  /** A message stored as read always carries its {@code readAt}. */
  private ChatMessage stampRead(ChatMessage m) {
    return m.read() && m.readAt() == null ? m.withRead(clock.instant()) : m;
  }

  private ChatMessage absorb(ChatMessage survivor, ChatMessage duplicate) {
    ChatMessage out = survivor;
    if (!out.hasCorrelationToken() && duplicate.hasCorrelationToken()) {
      out = out.withCorrelationToken(duplicate.correlationToken());
    }
    Instant readAt = duplicate.readAt() != null ? duplicate.readAt() : clock.instant();
    return StatusLattice.advance(out, duplicate.status(), readAt);
  }

  private ChatMessage mergeInto(Slot holder, Slot duplicate, ChatMessage duplicateMessage) {
    ChatMessage survivor = absorb(holder.message, duplicateMessage);
    slots.remove(duplicate);
    emit(ChangeKind.REMOVED, duplicateMessage);
    replace(holder, survivor);
    emit(ChangeKind.UPDATED, survivor);
    log.debug(
        "[solvix] Merged optimistic message {} into server record {} in chat {}",
        duplicateMessage.correlationToken(), survivor.serverId(), chatId);
    return survivor;
  }

  private Optional<ChatMessage> advance(Slot slot, MessageStatus status) {
    if (slot == null || status == null) return Optional.empty();
    ChatMessage next = StatusLattice.advance(slot.message, status, clock.instant());
    if (next == slot.message) return Optional.empty();
    replace(slot, next);
    emit(ChangeKind.UPDATED, next);
    return Optional.of(next);
  }

  private ChatMessage withOwnership(ChatMessage m) {
    long me = currentUserId.getAsLong();
    boolean own = me > 0 && m.senderId() == me;
    return own == m.ownMessage() ? m : m.withOwnMessage(own);
  }

  private void replace(Slot slot, ChatMessage next) {
    boolean moved = !slot.message.sentAt().equals(next.sentAt());
    slot.message = next;
    if (moved) {
      slots.remove(slot);
      insert(slot);
    }
  }

  private void insert(Slot slot) {
    int i = slots.size();
    while (i > 0 && compare(slots.get(i - 1), slot) > 0) i--;
    slots.add(i, slot);
  }

  private static int compare(Slot a, Slot b) {
    int c = a.message.sentAt().compareTo(b.message.sentAt());
    return c != 0 ? c : Long.compare(a.seq, b.seq);
  }

  private Slot slotOf(ChatMessage m) {
    for (Slot s : slots) {
      if (s.message == m) return s;
    }
    throw new IllegalStateException("Resolved message is not part of the store");
  }

  private Slot slotByServerId(long serverId) {
    if (serverId <= 0) return null;
    for (Slot s : slots) {
      if (s.message.serverId() == serverId) return s;
    }
    return null;
  }

  private Slot slotByCorrelation(String correlationToken) {
    String token = Objects.toString(correlationToken, "").trim();
    if (token.isEmpty()) return null;
    for (Slot s : slots) {
      if (token.equals(s.message.correlationToken())) return s;
    }
    return null;
  }

  private void emit(ChangeKind kind, ChatMessage message) {
    changes.onNext(new Change(chatId, kind, List.of(message)));
  }

  /** Live read-only view over the slots, in order. Only used while holding the store lock. */
  private final class SlotView extends AbstractList<ChatMessage> {
    @Override
    public ChatMessage get(int index) {
      return slots.get(index).message;
    }

    @Override
    public int size() {
      return slots.size();
    }
  }
}
