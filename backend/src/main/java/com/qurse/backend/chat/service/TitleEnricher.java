package com.qurse.backend.chat.service;

import com.qurse.backend.chat.config.TitleProperties;
import com.qurse.backend.chat.persistence.ConversationRepository;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import com.qurse.backend.chat.provider.ChatProviderService;
import java.time.Clock;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Replaces the truncated title of a new conversation with a generated one. Runs on the
 * background queue; failures are logged and never retried.
 */
@Service
@Slf4j
public class TitleEnricher {

  private static final String SYSTEM_PROMPT =
      """
      You write titles for chat conversations. Reply with a single title of at most %d \
      characters that names the topic of the user's message. No quotes, no trailing \
      punctuation, no explanations.""";

  private final ChatProviderService chatProviderService;
  private final ConversationRepository conversationRepository;
  private final BackgroundTasks backgroundTasks;
  private final TitleProperties properties;
  private final Clock clock;

  public TitleEnricher(
      ChatProviderService chatProviderService,
      ConversationRepository conversationRepository,
      BackgroundTasks backgroundTasks,
      TitleProperties properties,
      Clock clock) {
    this.chatProviderService = chatProviderService;
    this.conversationRepository = conversationRepository;
    this.backgroundTasks = backgroundTasks;
    this.properties = properties;
    this.clock = clock;
  }

  /** Schedules enrichment when the message is long enough to deserve a generated title. */
  public void enrich(UUID conversationId, String firstUserText) {
    if (!properties.isEnabled()
        || firstUserText == null
        || firstUserText.trim().length() <= properties.getMinLength()) {
      return;
    }
    backgroundTasks.submit(
        "title enrichment for " + conversationId, () -> generateAndApply(conversationId, firstUserText));
  }

  void generateAndApply(UUID conversationId, String firstUserText) {
    ChatProviderSelection selection =
        chatProviderService.resolveSelection(properties.getProvider(), properties.getModel());
    String raw =
        chatProviderService
            .chatClient(selection.providerId())
            .prompt()
            .system(SYSTEM_PROMPT.formatted(properties.getMaxLength()))
            .user(firstUserText.trim())
            .options(chatProviderService.buildOptions(selection))
            .call()
            .content();
    String title = cleanTitle(raw, properties.getMaxLength());
    if (title == null) {
      log.debug("Title generation for conversation {} returned nothing", conversationId);
      return;
    }
    int updated = conversationRepository.applyGeneratedTitle(conversationId, title, clock.instant());
    if (updated > 0) {
      log.debug("Generated title for conversation {}: {}", conversationId, title);
    }
  }

  static String cleanTitle(String raw, int maxLength) {
    if (!StringUtils.hasText(raw)) {
      return null;
    }
    String title = raw.replaceAll("\\s+", " ").trim();
    title = title.replaceAll("^[\"'`*]+|[\"'`*]+$", "").trim();
    if (title.endsWith(".")) {
      title = title.substring(0, title.length() - 1).trim();
    }
    if (title.isEmpty()) {
      return null;
    }
    if (title.length() > maxLength) {
      title = title.substring(0, maxLength).trim();
    }
    return title;
  }
}
