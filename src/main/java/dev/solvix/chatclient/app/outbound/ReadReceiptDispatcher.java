package dev.solvix.chatclient.app.outbound;

import dev.solvix.chatclient.api.ChatApi;
import dev.solvix.chatclient.config.ChatProperties;
import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.realtime.RealtimeChannel;
import dev.solvix.chatclient.util.ChatSchedulers;
import io.reactivex.rxjava3.core.Completable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tells the server which messages the user has seen.
 *
 * <p>Each id is reported on its own: over the real-time channel when it is connected, through the
 * API otherwise or when the channel fails.
 */
@Component
public class ReadReceiptDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ReadReceiptDispatcher.class);

  private final RealtimeChannel realtime;
  private final ChatApi api;
  private final ChatProperties props;
  private final ChatSchedulers schedulers;

  public ReadReceiptDispatcher(
      RealtimeChannel realtime, ChatApi api, ChatProperties props, ChatSchedulers schedulers) {
    this.realtime = Objects.requireNonNull(realtime, "realtime");
    this.api = Objects.requireNonNull(api, "api");
    this.props = Objects.requireNonNull(props, "props");
    this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
  }

  /**
   * Reports every id; completes with an error when at least one report could not be delivered by
   * either path. Every id is attempted regardless.
   */
  public Completable markAsRead(ChatId chatId, List<Long> serverIds) {
    Objects.requireNonNull(chatId, "chatId");
    if (serverIds == null || serverIds.isEmpty()) return Completable.complete();
    List<Completable> receipts = new ArrayList<>(serverIds.size());
    for (Long id : serverIds) {
      if (id == null || id <= 0) continue;
      receipts.add(receipt(chatId, id));
    }
    return Completable.mergeDelayError(receipts);
  }

  private Completable receipt(ChatId chatId, long serverId) {
    Completable viaApi =
        Completable.defer(() -> api.markAsRead(chatId, List.of(serverId)))
            .subscribeOn(schedulers.io())
            .timeout(props.apiSendTimeout().toMillis(), TimeUnit.MILLISECONDS, schedulers.timer());
    return Completable.defer(
        () -> {
          if (!realtime.isConnected()) return viaApi;
          return Completable.defer(() -> realtime.markAsRead(chatId, serverId))
              .subscribeOn(schedulers.io())
              .timeout(
                  props.realtimeSendTimeout().toMillis(), TimeUnit.MILLISECONDS, schedulers.timer())
              .onErrorResumeNext(
                  err -> {
                    log.debug(
                        "[solvix] Real-time read receipt for {} in {} failed; using the API", serverId, chatId, err);
                    return viaApi;
                  });
        });
  }
}
