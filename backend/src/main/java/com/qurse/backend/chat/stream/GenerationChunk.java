package com.qurse.backend.chat.stream;

/**
 * One element of a generator stream. A well-formed stream ends with exactly one {@code FINISH}
 * chunk; {@code usage} is null when the provider reported none.
 */
public record GenerationChunk(Kind kind, String text, GenerationUsage usage) {

  public enum Kind {
    TEXT,
    REASONING,
    FINISH
  }

  public static GenerationChunk text(String text) {
    return new GenerationChunk(Kind.TEXT, text, null);
  }

  public static GenerationChunk reasoning(String text) {
    return new GenerationChunk(Kind.REASONING, text, null);
  }

  public static GenerationChunk finish(GenerationUsage usage) {
    return new GenerationChunk(Kind.FINISH, null, usage);
  }
}
