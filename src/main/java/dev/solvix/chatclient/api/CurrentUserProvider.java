package dev.solvix.chatclient.api;

/** Identity of the signed-in user. */
@FunctionalInterface
public interface CurrentUserProvider {
  long UNAUTHENTICATED = 0L;

  /** @return the user id, or {@link #UNAUTHENTICATED} when nobody is signed in */
  long currentUserId();

  default boolean isAuthenticated() {
    return currentUserId() > UNAUTHENTICATED;
  }
}
