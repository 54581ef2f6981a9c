package com.qurse.backend.chat.persistence;

import com.qurse.backend.chat.domain.ChatMessage;
import com.qurse.backend.chat.domain.ChatRole;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  Optional<ChatMessage> findTopByConversationIdAndRoleOrderByCreatedAtDesc(
      UUID conversationId, ChatRole role);

  @Query(
      value =
          "select * from chat_message where conversation_id = :conversationId "
              + "order by created_at desc, id desc limit :limit offset :offset",
      nativeQuery = true)
  List<ChatMessage> findNewestPage(
      @Param("conversationId") UUID conversationId,
      @Param("limit") int limit,
      @Param("offset") int offset);

  long countByConversationId(UUID conversationId);

  long countByConversationIdAndRole(UUID conversationId, ChatRole role);

  List<ChatMessage> findByConversationIdAndRoleAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(
      UUID conversationId, ChatRole role, Instant since);

  @Query(
      "select distinct m.conversationId from ChatMessage m "
          + "where m.role = :role and m.createdAt >= :since")
  List<UUID> findConversationIdsWithRoleSince(
      @Param("role") ChatRole role, @Param("since") Instant since);
}
