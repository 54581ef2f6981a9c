package com.qurse.backend.chat.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.api.ChatStreamRequest;
import com.qurse.backend.chat.domain.ChatRole;
import com.qurse.backend.chat.domain.TextPart;
import com.qurse.backend.common.exception.FieldViolation;
import com.qurse.backend.common.exception.RequestValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ChatRequestValidatorTest {

  private final ChatRequestValidator validator = new ChatRequestValidator();

  @Test
  void acceptsDurableAndPlaceholderConversationIds() {
    String durable = UUID.randomUUID().toString();
    String placeholder = "temp-" + UUID.randomUUID();

    assertThatCode(() -> validator.validate(request(durable, ChatMessagePayload.user("Hi"))))
        .doesNotThrowAnyException();
    assertThatCode(() -> validator.validate(request(placeholder, ChatMessagePayload.user("Hi"))))
        .doesNotThrowAnyException();
    assertThatCode(() -> validator.validate(request(null, ChatMessagePayload.user("Hi"))))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsMalformedConversationId() {
    assertThatThrownBy(() -> validator.validate(request("conversation-42", ChatMessagePayload.user("Hi"))))
        .isInstanceOfSatisfying(
            RequestValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(FieldViolation::field)
                    .containsExactly("conversationId"));
  }

  @Test
  void rejectsHistoryEndingWithAssistantMessage() {
    ChatMessagePayload assistant =
        new ChatMessagePayload(null, ChatRole.ASSISTANT, null, "Sure, here you go");

    assertThatThrownBy(
            () -> validator.validate(request(null, ChatMessagePayload.user("Hi"), assistant)))
        .isInstanceOfSatisfying(
            RequestValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(FieldViolation::field)
                    .containsExactly("messages"));
  }

  @Test
  void rejectsOversizedMessageAtExactLimitPlusOne() {
    String atLimit = "a".repeat(ChatRequestValidator.MAX_TEXT_LENGTH);

    assertThatCode(() -> validator.validate(request(null, ChatMessagePayload.user(atLimit))))
        .doesNotThrowAnyException();
    assertThatThrownBy(
            () -> validator.validate(request(null, ChatMessagePayload.user(atLimit + "a"))))
        .isInstanceOfSatisfying(
            RequestValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(FieldViolation::field)
                    .containsExactly("messages[0]"));
  }

  @Test
  void rejectsMessageWithoutContentAndNullParts() {
    ChatMessagePayload empty = new ChatMessagePayload(null, ChatRole.USER, List.of(), " ");
    ChatMessagePayload withNullPart =
        new ChatMessagePayload(null, ChatRole.USER, Arrays.asList(new TextPart("ok"), null), null);

    assertThatThrownBy(() -> validator.validate(request(null, empty, withNullPart)))
        .isInstanceOfSatisfying(
            RequestValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(FieldViolation::field)
                    .containsExactly("messages[0]", "messages[1].parts[1]"));
  }

  @Test
  void validatesSingleStoppedMessage() {
    ChatMessagePayload empty = new ChatMessagePayload(null, ChatRole.ASSISTANT, null, null);

    assertThatThrownBy(() -> validator.validateMessage("message", empty))
        .isInstanceOfSatisfying(
            RequestValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(FieldViolation::field)
                    .containsExactly("message"));
  }

  private static ChatStreamRequest request(String conversationId, ChatMessagePayload... messages) {
    return new ChatStreamRequest(conversationId, null, null, List.of(messages));
  }
}
