package dev.solvix.chatclient.app.api;

import dev.solvix.chatclient.model.ChatId;
import io.reactivex.rxjava3.core.Flowable;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Boundary between chat sessions and whatever surface shows transient notices to the user. */
@ApplicationLayer
public interface UserNotificationPort {

  void showTransient(NotificationKind kind, ChatId chatId, String message);

  default void showTransient(NotificationKind kind, String message) {
    showTransient(kind, null, message);
  }

  Flowable<TransientNotification> notifications();
}
