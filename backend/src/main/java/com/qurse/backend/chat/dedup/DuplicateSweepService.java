package com.qurse.backend.chat.dedup;

import com.qurse.backend.chat.config.DuplicateDetectionProperties;
import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.metrics.ChatMetrics;
import com.qurse.backend.chat.persistence.ChatMessageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Offline reconciliation of assistant duplicates that reached the store. Conversations are
 * processed one at a time; a failure in one does not stop the others.
 */
@Service
@Slf4j
public class DuplicateSweepService {

  private final ChatMessageRepository chatMessageRepository;
  private final DuplicateResolver duplicateResolver;
  private final DuplicateDetectionProperties properties;
  private final ChatMetrics chatMetrics;
  private final Clock clock;

  public DuplicateSweepService(
      ChatMessageRepository chatMessageRepository,
      DuplicateResolver duplicateResolver,
      DuplicateDetectionProperties properties,
      ChatMetrics chatMetrics,
      Clock clock) {
    this.chatMessageRepository = chatMessageRepository;
    this.duplicateResolver = duplicateResolver;
    this.properties = properties;
    this.chatMetrics = chatMetrics;
    this.clock = clock;
  }

  public DuplicateSweepReport sweep() {
    Instant since = clock.instant().minus(properties.getSweepLookback());
    List<UUID> conversationIds =
        chatMessageRepository.findConversationIdsWithRoleSince(ChatRole.ASSISTANT, since);
    List<DuplicateDeletion> deleted = new ArrayList<>();
    for (UUID conversationId : conversationIds) {
      try {
        deleted.addAll(sweepConversation(conversationId, since));
      } catch (RuntimeException ex) {
        log.warn("Duplicate sweep failed for conversation {}", conversationId, ex);
      }
    }
    chatMetrics.recordDuplicatesDeleted(deleted.size());
    log.info(
        "Duplicate sweep since {} scanned {} conversations, deleted {} messages",
        since,
        conversationIds.size(),
        deleted.size());
    return new DuplicateSweepReport(since, conversationIds.size(), deleted.size(), deleted);
  }

  public List<DuplicateDeletion> sweepConversation(UUID conversationId, Instant since) {
    List<ChatMessage> messages =
        chatMessageRepository
            .findByConversationIdAndRoleAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(
                conversationId, ChatRole.ASSISTANT, since);
    List<AssistantCandidate> candidates = messages.stream().map(AssistantCandidate::of).toList();
    List<DuplicateDeletion> deletions = findDuplicates(conversationId, candidates);
    if (!deletions.isEmpty()) {
      chatMessageRepository.deleteAllByIdInBatch(
          deletions.stream().map(DuplicateDeletion::id).toList());
    }
    return deletions;
  }

  /** Pairs every two live candidates within the window; oldest first, losers drop out. */
  List<DuplicateDeletion> findDuplicates(UUID conversationId, List<AssistantCandidate> candidates) {
    Duration window = properties.getWindow();
    Set<UUID> discarded = new HashSet<>();
    List<DuplicateDeletion> deletions = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      AssistantCandidate first = candidates.get(i);
      for (int j = i + 1; j < candidates.size(); j++) {
        if (discarded.contains(first.id())) {
          break;
        }
        AssistantCandidate second = candidates.get(j);
        if (discarded.contains(second.id())) {
          continue;
        }
        if (Duration.between(first.createdAt(), second.createdAt()).compareTo(window) > 0) {
          break;
        }
        if (!duplicateResolver.isDuplicate(first, second)) {
          continue;
        }
        DuplicateResolution resolution = duplicateResolver.choose(first, second);
        AssistantCandidate loser = resolution.discard();
        discarded.add(loser.id());
        deletions.add(
            new DuplicateDeletion(
                loser.id(),
                resolution.keep().id(),
                conversationId,
                loser.createdAt(),
                resolution.reason().description()));
      }
    }
    return deletions;
  }
}
