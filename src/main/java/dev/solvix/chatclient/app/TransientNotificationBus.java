package dev.solvix.chatclient.app;

import dev.solvix.chatclient.app.api.NotificationKind;
import dev.solvix.chatclient.app.api.TransientNotification;
import dev.solvix.chatclient.app.api.UserNotificationPort;
import dev.solvix.chatclient.model.ChatId;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default {@link UserNotificationPort}: logs every notice and republishes it for the UI. */
@Component
public class TransientNotificationBus implements UserNotificationPort {
  private static final Logger log = LoggerFactory.getLogger(TransientNotificationBus.class);

  private final FlowableProcessor<TransientNotification> notifications =
      PublishProcessor.<TransientNotification>create().toSerialized();

  @Override
  public void showTransient(NotificationKind kind, ChatId chatId, String message) {
    if (message == null || message.isBlank()) return;
    TransientNotification n = new TransientNotification(null, kind, chatId, message.trim());
    switch (n.kind()) {
      case ERROR, AUTH ->
          log.warn("[solvix] {} notice for {}: {}", n.kind(), chatLabel(chatId), n.message());
      default ->
          log.info("[solvix] {} notice for {}: {}", n.kind(), chatLabel(chatId), n.message());
    }
    notifications.onNext(n);
  }

  @Override
  public Flowable<TransientNotification> notifications() {
    return notifications.onBackpressureBuffer();
  }

  private static String chatLabel(ChatId chatId) {
    return chatId == null ? "all chats" : chatId.toString();
  }
}
