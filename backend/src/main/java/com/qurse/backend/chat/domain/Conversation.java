package com.qurse.backend.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Persistable;

/**
 * Conversation row. The identifier is assigned by the caller, so {@link #isNew()} is tracked
 * explicitly to make {@code save} issue a plain insert that surfaces unique-key conflicts.
 */
@Entity
@Table(name = "conversation")
public class Conversation implements Persistable<UUID> {

  @Id private UUID id;

  @Column(name = "user_id", length = 128, updatable = false)
  private String userId;

  @Column(name = "session_hash", length = 128, updatable = false)
  private String sessionHash;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "title_generated", nullable = false)
  private boolean titleGenerated;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Transient private boolean fresh = true;

  protected Conversation() {}

  public Conversation(UUID id, ConversationOwner owner, String title) {
    this.id = id;
    this.userId = owner.userId();
    this.sessionHash = owner.sessionHash();
    this.title = title;
  }

  @PrePersist
  protected void onPersist() {
    Instant now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  @PostLoad
  @PostPersist
  protected void markPersisted() {
    this.fresh = false;
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public boolean isNew() {
    return fresh;
  }

  public String getUserId() {
    return userId;
  }

  public String getSessionHash() {
    return sessionHash;
  }

  public String getTitle() {
    return title;
  }

  public boolean isTitleGenerated() {
    return titleGenerated;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
