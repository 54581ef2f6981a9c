package com.qurse.backend.chat.stream;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/** Turns currently streaming, by conversation, so that a stop request can reach them. */
@Component
public class ActiveTurnRegistry {

  private final ConcurrentMap<UUID, GenerationTurn> turns = new ConcurrentHashMap<>();

  void register(GenerationTurn turn) {
    turns.put(turn.conversationId(), turn);
  }

  void unregister(GenerationTurn turn) {
    turns.remove(turn.conversationId(), turn);
  }

  public Optional<GenerationTurn> find(UUID conversationId) {
    return Optional.ofNullable(turns.get(conversationId));
  }
}
