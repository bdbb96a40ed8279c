package dev.solvix.chatclient.app.core;

import dev.solvix.chatclient.api.ChatApi;
import dev.solvix.chatclient.api.CurrentUserProvider;
import dev.solvix.chatclient.app.api.UserNotificationPort;
import dev.solvix.chatclient.app.outbound.MessageDeliveryDispatcher;
import dev.solvix.chatclient.app.outbound.ReadReceiptDispatcher;
import dev.solvix.chatclient.app.state.ChatSummaryState;
import dev.solvix.chatclient.config.ChatProperties;
import dev.solvix.chatclient.realtime.RealtimeChannel;
import dev.solvix.chatclient.realtime.RealtimeSubscriptionRegistry;
import dev.solvix.chatclient.util.ChatSchedulers;
import java.time.Clock;
import org.springframework.stereotype.Component;

/** Creates one {@link ChatSessionEngine} per chat screen, wired to the shared collaborators. */
@Component
public class ChatSessionFactory {

  private final RealtimeSubscriptionRegistry registry;
  private final RealtimeChannel realtime;
  private final ChatApi api;
  private final CurrentUserProvider users;
  private final MessageDeliveryDispatcher delivery;
  private final ReadReceiptDispatcher receipts;
  private final ChatSummaryState summaries;
  private final UserNotificationPort notifications;
  private final ChatProperties props;
  private final ChatSchedulers schedulers;

  public ChatSessionFactory(
      RealtimeSubscriptionRegistry registry,
      RealtimeChannel realtime,
      ChatApi api,
      CurrentUserProvider users,
      MessageDeliveryDispatcher delivery,
      ReadReceiptDispatcher receipts,
      ChatSummaryState summaries,
      UserNotificationPort notifications,
      ChatProperties props,
      ChatSchedulers schedulers) {
    this.registry = registry;
    this.realtime = realtime;
    this.api = api;
    this.users = users;
    this.delivery = delivery;
    this.receipts = receipts;
    this.summaries = summaries;
    this.notifications = notifications;
    this.props = props;
    this.schedulers = schedulers;
  }

  public ChatSessionEngine create() {
    return new ChatSessionEngine(
        registry,
        realtime,
        api,
        users,
        delivery,
        receipts,
        summaries,
        notifications,
        props,
        schedulers,
        Clock.systemUTC());
  }
}
