package dev.solvix.chatclient.app.api;

/** Severity of a transient user notification. */
public enum NotificationKind {
  INFO,
  WARNING,
  ERROR,
  /** The user needs to sign in again. */
  AUTH
}
