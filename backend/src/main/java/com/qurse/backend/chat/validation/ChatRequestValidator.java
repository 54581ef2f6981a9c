package com.qurse.backend.chat.validation;

import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.api.ChatStreamRequest;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.MessagePart;
import com.qurse.backend.chat.domain.MessageParts;
import com.qurse.backend.chat.service.ConversationIds;
import com.qurse.backend.common.exception.FieldViolation;
import com.qurse.backend.common.exception.RequestValidationException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks that bean validation cannot express: id formats, the text limit of a message and the
 * shape of the history.
 */
@Component
public class ChatRequestValidator {

  public static final int MAX_TEXT_LENGTH = 10_000;

  public void validate(ChatStreamRequest request) {
    List<FieldViolation> violations = new ArrayList<>();
    String conversationId = request.conversationId();
    if (StringUtils.hasText(conversationId) && !ConversationIds.isWellFormed(conversationId)) {
      violations.add(
          new FieldViolation("conversationId", "conversationId must be a UUID or a temp- id"));
    }

    List<ChatMessagePayload> messages = request.messages();
    for (int index = 0; index < messages.size(); index++) {
      validateMessage("messages[" + index + "]", messages.get(index), violations);
    }
    if (!messages.isEmpty() && messages.get(messages.size() - 1).role() != ChatRole.USER) {
      violations.add(new FieldViolation("messages", "The last message must be a user message"));
    }

    if (!violations.isEmpty()) {
      throw new RequestValidationException(violations);
    }
  }

  /** Checks one message on its own, as sent to the stop-save endpoint. */
  public void validateMessage(String field, ChatMessagePayload message) {
    List<FieldViolation> violations = new ArrayList<>();
    validateMessage(field, message, violations);
    if (!violations.isEmpty()) {
      throw new RequestValidationException(violations);
    }
  }

  private void validateMessage(
      String field, ChatMessagePayload message, List<FieldViolation> violations) {
    List<MessagePart> parts = message.effectiveParts();
    if (parts.isEmpty()) {
      violations.add(new FieldViolation(field, "Message must have parts or content"));
      return;
    }
    for (int index = 0; index < parts.size(); index++) {
      if (parts.get(index) == null) {
        violations.add(new FieldViolation(field + ".parts[" + index + "]", "Part must not be null"));
        return;
      }
    }
    if (MessageParts.textProjection(parts).length() > MAX_TEXT_LENGTH) {
      violations.add(
          new FieldViolation(
              field, "Message content must not exceed " + MAX_TEXT_LENGTH + " characters"));
    }
  }
}
