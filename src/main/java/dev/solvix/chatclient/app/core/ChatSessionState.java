package dev.solvix.chatclient.app.core;

/** Lifecycle of a {@link ChatSessionEngine}. */
public enum ChatSessionState {
  /** No chat opened yet. */
  IDLE,
  /** A chat was opened and its first page is loading. */
  LOADING,
  READY,
  CLOSED
}
