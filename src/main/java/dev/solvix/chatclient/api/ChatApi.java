package dev.solvix.chatclient.api;

import dev.solvix.chatclient.model.ChatId;
import dev.solvix.chatclient.model.ChatMessage;
import dev.solvix.chatclient.model.ChatSummary;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import java.util.List;

/** Request/response access to the chat server. Implemented by the host application. */
public interface ChatApi {

  /**
   * A page of messages, counted back from the newest one.
   *
   * @param offset number of most recent messages to skip
   */
  Single<List<ChatMessage>> getMessages(ChatId chatId, int offset, int limit);

  /**
   * Sends a message outside the real-time channel.
   *
   * @return the server record of the message, or empty when the server did not accept it
   */
  Maybe<ChatMessage> sendMessage(ChatId chatId, String content);

  Completable markAsRead(ChatId chatId, List<Long> serverIds);

  /** Chat details used to seed the chat summary. */
  default Maybe<ChatSummary> getChat(ChatId chatId) {
    return Maybe.empty();
  }
}
