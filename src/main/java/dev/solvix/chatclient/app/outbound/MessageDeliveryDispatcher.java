package dev.solvix.chatclient.app.outbound;

import dev.solvix.chatclient.api.ChatApi;
import dev.solvix.chatclient.config.ChatProperties;
import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.realtime.RealtimeChannel;
import dev.solvix.chatclient.util.ChatSchedulers;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers optimistic messages: real-time channel first, request/response API as fallback.
 *
 * <p>Every dispatch is its own chain with its own timeouts, so a stalled message never holds up
 * another one. The returned {@link Single} never signals an error; every failure becomes
 * {@link DeliveryOutcome.Failed}.
 */
@Component
public class MessageDeliveryDispatcher {
  private static final Logger log = LoggerFactory.getLogger(MessageDeliveryDispatcher.class);

  private final RealtimeChannel realtime;
  private final ChatApi api;
  private final ChatProperties props;
  private final ChatSchedulers schedulers;

  public MessageDeliveryDispatcher(
      RealtimeChannel realtime, ChatApi api, ChatProperties props, ChatSchedulers schedulers) {
    this.realtime = Objects.requireNonNull(realtime, "realtime");
    this.api = Objects.requireNonNull(api, "api");
    this.props = Objects.requireNonNull(props, "props");
    this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
  }

  /** Creates the optimistic placeholder for {@code content}: Sending, fresh token, sent now. */
  public ChatMessage prepare(ChatId chatId, long senderId, String content) {
    return ChatMessage.optimistic(UUID.randomUUID().toString(), chatId, senderId, content, now());
  }

  public Single<DeliveryOutcome> dispatch(ChatMessage optimistic) {
    Objects.requireNonNull(optimistic, "optimistic");
    String token = optimistic.correlationToken();
    return Single.defer(
            () -> {
              if (!realtime.isConnected()) {
                log.debug("[solvix] Real-time channel offline; sending {} through the API", token);
                return viaApi(optimistic);
              }
              return viaRealtime(optimistic)
                  .onErrorResumeNext(
                      err -> {
                        log.warn(
                            "[solvix] Real-time send of {} failed ({}); falling back to the API",
                            token, describe(err));
                        return viaApi(optimistic);
                      });
            })
        .onErrorReturn(err -> failed(token, err));
  }

  private Single<DeliveryOutcome> viaRealtime(ChatMessage optimistic) {
    String token = optimistic.correlationToken();
    return Single.defer(() -> realtime.send(optimistic))
        .subscribeOn(schedulers.io())
        .timeout(props.realtimeSendTimeout().toMillis(), TimeUnit.MILLISECONDS, schedulers.timer())
        .flatMap(
            accepted ->
                Boolean.TRUE.equals(accepted)
                    ? Single.<DeliveryOutcome>just(new DeliveryOutcome.Accepted(token))
                    : Single.<DeliveryOutcome>error(
                        new IllegalStateException("real-time channel rejected the message")));
  }

  private Single<DeliveryOutcome> viaApi(ChatMessage optimistic) {
    String token = optimistic.correlationToken();
    return Maybe.defer(() -> api.sendMessage(optimistic.chatId(), optimistic.content()))
        .subscribeOn(schedulers.io())
        .timeout(props.apiSendTimeout().toMillis(), TimeUnit.MILLISECONDS, schedulers.timer())
        .<DeliveryOutcome>map(
            server -> new DeliveryOutcome.Confirmed(token, server.withCorrelationToken(token)))
        .defaultIfEmpty(new DeliveryOutcome.Failed(token, "The server did not accept the message"))
        .onErrorReturn(err -> failed(token, err));
  }

  private DeliveryOutcome failed(String token, Throwable err) {
    log.warn("[solvix] Delivery of {} failed: {}", token, describe(err));
    return new DeliveryOutcome.Failed(token, describe(err));
  }

  private Instant now() {
    return Instant.ofEpochMilli(schedulers.timer().now(TimeUnit.MILLISECONDS));
  }

  static String describe(Throwable err) {
    if (err instanceof TimeoutException) return "timed out";
    String msg = (err == null) ? null : err.getMessage();
    if (msg == null || msg.isBlank()) return err == null ? "unknown error" : err.getClass().getSimpleName();
    return msg;
  }
}
