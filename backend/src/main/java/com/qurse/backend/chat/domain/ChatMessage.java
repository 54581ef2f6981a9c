package com.qurse.backend.chat.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.qurse.backend.chat.domain.converter.MessagePartJsonCodec;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "chat_message")
public class ChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
  private Conversation conversation;

  @Column(name = "conversation_id", insertable = false, updatable = false)
  private UUID conversationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32, updatable = false)
  private ChatRole role;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parts", nullable = false, updatable = false, columnDefinition = "jsonb")
  private JsonNode parts;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String content;

  @Column(name = "is_stopped", nullable = false)
  private boolean stopped;

  @Column(name = "model", length = 128)
  private String model;

  @Column(name = "input_tokens")
  private Integer inputTokens;

  @Column(name = "output_tokens")
  private Integer outputTokens;

  @Column(name = "total_tokens")
  private Integer totalTokens;

  @Column(name = "completion_time")
  private Double completionTime;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatMessage() {}

  public ChatMessage(
      Conversation conversation, ChatRole role, List<MessagePart> parts, String content) {
    this.conversation = conversation;
    this.conversationId = conversation.getId();
    this.role = role;
    this.parts = MessagePartJsonCodec.encode(parts);
    this.content = content;
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public UUID getConversationId() {
    return conversationId;
  }

  public ChatRole getRole() {
    return role;
  }

  public List<MessagePart> getParts() {
    return MessagePartJsonCodec.decode(parts);
  }

  public String getContent() {
    return content;
  }

  public boolean isStopped() {
    return stopped;
  }

  public void markStopped() {
    this.stopped = true;
  }

  public String getModel() {
    return model;
  }

  public Integer getInputTokens() {
    return inputTokens;
  }

  public Integer getOutputTokens() {
    return outputTokens;
  }

  public Integer getTotalTokens() {
    return totalTokens;
  }

  public Double getCompletionTime() {
    return completionTime;
  }

  public void applyGeneration(GenerationMetadata metadata) {
    if (metadata == null) {
      return;
    }
    this.model = metadata.model();
    this.completionTime = metadata.completionTime();
    this.inputTokens = metadata.inputTokens();
    this.outputTokens = metadata.outputTokens();
    this.totalTokens = metadata.totalTokens();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
