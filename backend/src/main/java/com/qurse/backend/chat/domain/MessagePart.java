package com.qurse.backend.chat.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One typed segment of a chat message. The JSON form carries a {@code type} discriminator
 * matching {@link MessagePartKind#wireName()}. Projections switch over {@link #kind()} so that a
 * new kind does not compile until every projection handles it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextPart.class, name = "text"),
  @JsonSubTypes.Type(value = ReasoningPart.class, name = "reasoning"),
  @JsonSubTypes.Type(value = ToolInvocationPart.class, name = "tool-invocation"),
  @JsonSubTypes.Type(value = FilePart.class, name = "file")
})
public interface MessagePart {

  @JsonIgnore
  MessagePartKind kind();
}
