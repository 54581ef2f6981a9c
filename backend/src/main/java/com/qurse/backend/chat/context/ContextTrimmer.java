package com.qurse.backend.chat.context;

import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.config.ContextWindowProperties;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.MessagePartKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Fits a history into the model's context budget. Reasoning is removed from all but the latest
 * messages first; only then are the oldest messages dropped, down to a minimum count.
 */
@Slf4j
public class ContextTrimmer {

  private final TokenCounter tokenCounter;
  private final ContextWindowProperties properties;

  public ContextTrimmer(TokenCounter tokenCounter, ContextWindowProperties properties) {
    this.tokenCounter = tokenCounter;
    this.properties = properties;
  }

  public ContextTrimResult trim(
      List<ChatMessagePayload> messages, ChatProvidersProperties.Model model) {
    String tokenizer = model.getTokenizer();
    long budget = (long) model.getContextWindow() * properties.getBudgetPercent() / 100;
    int originalTokens = tokenCounter.countMessages(messages, tokenizer);
    if (originalTokens <= budget) {
      return new ContextTrimResult(messages, originalTokens, originalTokens, 0, 0);
    }

    List<ChatMessagePayload> working = new ArrayList<>(messages.size());
    int removedReasoningFrom = 0;
    int reasoningCutoff = Math.max(0, messages.size() - properties.getKeepReasoningCount());
    for (int index = 0; index < messages.size(); index++) {
      ChatMessagePayload message = messages.get(index);
      if (index >= reasoningCutoff) {
        working.add(message);
        continue;
      }
      List<MessagePart> parts = message.effectiveParts();
      List<MessagePart> kept =
          parts.stream().filter(part -> part.kind() != MessagePartKind.REASONING).toList();
      if (kept.size() == parts.size()) {
        working.add(message);
        continue;
      }
      removedReasoningFrom++;
      if (!kept.isEmpty()) {
        working.add(new ChatMessagePayload(message.id(), message.role(), kept, null));
      }
    }

    int tokens = tokenCounter.countMessages(working, tokenizer);
    int droppedMessages = 0;
    int minKeep = Math.min(properties.getMinMessagesKeep(), working.size());
    while (working.size() > minKeep && tokens > budget) {
      ChatMessagePayload removed = working.remove(0);
      tokens -= tokenCounter.countMessage(removed, tokenizer);
      droppedMessages++;
    }

    log.info(
        "Trimmed context from {} to {} tokens (budget {}): reasoning removed from {}, dropped {}",
        originalTokens,
        tokens,
        budget,
        removedReasoningFrom,
        droppedMessages);
    return new ContextTrimResult(
        List.copyOf(working), originalTokens, tokens, removedReasoningFrom, droppedMessages);
  }
}
