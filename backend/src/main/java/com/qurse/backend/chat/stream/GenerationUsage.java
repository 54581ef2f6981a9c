package com.qurse.backend.chat.stream;

public record GenerationUsage(Integer inputTokens, Integer outputTokens, Integer totalTokens) {

  public boolean isEmpty() {
    return (totalTokens == null || totalTokens == 0)
        && (inputTokens == null || inputTokens == 0)
        && (outputTokens == null || outputTokens == 0);
  }
}
