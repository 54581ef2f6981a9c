package com.qurse.backend.chat.domain;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolInvocationPart(
    String toolCallId, String toolName, String state, JsonNode input, JsonNode output)
    implements MessagePart {

  @Override
  public MessagePartKind kind() {
    return MessagePartKind.TOOL_INVOCATION;
  }
}
