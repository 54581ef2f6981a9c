package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.domain.MessageParts;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import com.qurse.backend.chat.provider.ChatProviderService;
import com.qurse.backend.common.exception.ProviderException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** {@link ChatGenerator} backed by the Spring AI chat client of the selected provider. */
@Component
@Slf4j
public class SpringAiChatGenerator implements ChatGenerator {

  static final String REASONING_METADATA_KEY = "reasoningContent";

  private final ChatProviderService chatProviderService;

  public SpringAiChatGenerator(ChatProviderService chatProviderService) {
    this.chatProviderService = chatProviderService;
  }

  @Override
  public Flux<GenerationChunk> stream(GenerationRequest request, CancellationBridge bridge) {
    ChatProviderSelection selection = request.selection();
    AtomicReference<Usage> usageRef = new AtomicReference<>();
    return Flux.defer(
            () -> {
              if (bridge.isCancelled()) {
                return Flux.<ChatResponse>empty();
              }
              return chatProviderService
                  .chatClient(selection.providerId())
                  .prompt()
                  .messages(toMessages(request))
                  .options(chatProviderService.buildStreamingOptions(selection))
                  .stream()
                  .chatResponse();
            })
        .flatMapIterable(response -> toChunks(response, usageRef))
        .concatWith(Mono.fromSupplier(() -> GenerationChunk.finish(toUsage(usageRef.get()))))
        .onErrorMap(error -> translate(error, selection));
  }

  List<Message> toMessages(GenerationRequest request) {
    List<Message> messages = new ArrayList<>(request.messages().size() + 1);
    if (StringUtils.hasText(request.systemPrompt())) {
      messages.add(new SystemMessage(request.systemPrompt()));
    }
    for (ChatMessagePayload payload : request.messages()) {
      String text = MessageParts.textProjection(payload.effectiveParts());
      if (!StringUtils.hasText(text)) {
        continue;
      }
      messages.add(
          switch (payload.role()) {
            case USER -> new UserMessage(text);
            case ASSISTANT -> new AssistantMessage(text);
            case SYSTEM -> new SystemMessage(text);
          });
    }
    return messages;
  }

  private List<GenerationChunk> toChunks(ChatResponse response, AtomicReference<Usage> usageRef) {
    ChatResponseMetadata metadata = response.getMetadata();
    if (metadata != null && metadata.getUsage() != null) {
      usageRef.set(metadata.getUsage());
    }
    List<GenerationChunk> chunks = new ArrayList<>(2);
    for (Generation generation : response.getResults()) {
      AssistantMessage output = generation.getOutput();
      if (output == null) {
        continue;
      }
      Object reasoning = output.getMetadata().get(REASONING_METADATA_KEY);
      if (reasoning instanceof String reasoningText && !reasoningText.isEmpty()) {
        chunks.add(GenerationChunk.reasoning(reasoningText));
      }
      String text = output.getText();
      if (text != null && !text.isEmpty()) {
        chunks.add(GenerationChunk.text(text));
      }
    }
    return chunks;
  }

  private GenerationUsage toUsage(Usage usage) {
    if (usage == null) {
      return null;
    }
    GenerationUsage converted =
        new GenerationUsage(
            usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
    return converted.isEmpty() ? null : converted;
  }

  private Throwable translate(Throwable error, ChatProviderSelection selection) {
    if (error instanceof GeneratorAbortException || error instanceof ProviderException) {
      return error;
    }
    if (error instanceof CancellationException) {
      return new GeneratorAbortException("Provider stream was cancelled", error);
    }
    if (error instanceof WebClientResponseException responseError) {
      int status = responseError.getStatusCode().value();
      log.warn(
          "Provider {} rejected model {} with status {}: {}",
          selection.providerId(),
          selection.modelId(),
          status,
          sanitize(responseError.getResponseBodyAsString()));
      if (status == 401 || status == 403) {
        return new GeneratorAbortException("Provider refused the credentials", error);
      }
      return new ProviderException(error);
    }
    return new ProviderException(error);
  }

  private String sanitize(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    String normalized = value.replaceAll("\\s+", " ").trim();
    int maxLength = 500;
    if (normalized.length() <= maxLength) {
      return normalized;
    }
    return normalized.substring(0, maxLength) + "...";
  }
}
