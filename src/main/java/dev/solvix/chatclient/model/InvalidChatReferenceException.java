package dev.solvix.chatclient.model;

import java.util.Objects;

/** Thrown when a chat identifier cannot be parsed. */
public class InvalidChatReferenceException extends IllegalArgumentException {

  private final String rawReference;

  public InvalidChatReferenceException(String rawReference) {
    super("Invalid chat reference: '" + Objects.toString(rawReference, "") + "'");
    this.rawReference = Objects.toString(rawReference, "");
  }

  public InvalidChatReferenceException(String rawReference, Throwable cause) {
    super("Invalid chat reference: '" + Objects.toString(rawReference, "") + "'", cause);
    this.rawReference = Objects.toString(rawReference, "");
  }

  public String rawReference() {
    return rawReference;
  }
}
