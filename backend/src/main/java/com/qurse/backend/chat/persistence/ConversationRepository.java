package com.qurse.backend.chat.persistence;

import com.qurse.backend.chat.domain.Conversation;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  /** Replaces the title once; later calls are no-ops. */
  @Modifying
  @Transactional
  @Query(
      "update Conversation c set c.title = :title, c.titleGenerated = true, c.updatedAt = :now "
          + "where c.id = :id and c.titleGenerated = false")
  int applyGeneratedTitle(
      @Param("id") UUID id, @Param("title") String title, @Param("now") Instant now);

  @Modifying
  @Transactional
  @Query("update Conversation c set c.updatedAt = :now where c.id = :id")
  int touch(@Param("id") UUID id, @Param("now") Instant now);

  /**
   * Hands every conversation of an anonymous session to {@code userId}. Rows that already belong
   * to a user are never matched.
   */
  @Modifying
  @Transactional
  @Query(
      value =
          "UPDATE conversation SET user_id = :userId, session_hash = NULL "
              + "WHERE session_hash = :sessionHash AND user_id IS NULL",
      nativeQuery = true)
  int transferGuest(@Param("sessionHash") String sessionHash, @Param("userId") String userId);
}
