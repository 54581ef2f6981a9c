package com.qurse.backend.chat.domain;

import java.util.List;

/** Projections over a part sequence. */
public final class MessageParts {

  /** In-band sentinel appended by the client when the user stops a generation. */
  public static final String STOP_MARKER = "*User stopped this message here*";

  private MessageParts() {}

  /** Concatenation of every text part, in order. */
  public static String textProjection(List<MessagePart> parts) {
    if (parts == null || parts.isEmpty()) {
      return "";
    }
    StringBuilder builder = new StringBuilder();
    for (MessagePart part : parts) {
      String fragment =
          switch (part.kind()) {
            case TEXT -> ((TextPart) part).text();
            case REASONING, TOOL_INVOCATION, FILE -> null;
          };
      if (fragment != null) {
        builder.append(fragment);
      }
    }
    return builder.toString();
  }

  /** Concatenation of every reasoning part, in order. */
  public static String reasoningProjection(List<MessagePart> parts) {
    if (parts == null || parts.isEmpty()) {
      return "";
    }
    StringBuilder builder = new StringBuilder();
    for (MessagePart part : parts) {
      String fragment =
          switch (part.kind()) {
            case REASONING -> ((ReasoningPart) part).text();
            case TEXT, TOOL_INVOCATION, FILE -> null;
          };
      if (fragment != null) {
        builder.append(fragment);
      }
    }
    return builder.toString();
  }

  public static boolean containsStopMarker(String text) {
    return text != null && text.contains(STOP_MARKER);
  }

  public static List<MessagePart> ofText(String text) {
    return List.of(new TextPart(text));
  }
}
