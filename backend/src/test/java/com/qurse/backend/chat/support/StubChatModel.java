package com.qurse.backend.chat.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/** Chat model answering from queued responses and recording every prompt it receives. */
public class StubChatModel implements ChatModel {

  private final Deque<Object> syncResponses = new ArrayDeque<>();
  private final List<Prompt> prompts = new CopyOnWriteArrayList<>();
  private Flux<ChatResponse> streamResponse = Flux.empty();

  public synchronized StubChatModel replyWith(ChatResponse response) {
    syncResponses.add(response);
    return this;
  }

  public synchronized StubChatModel failWith(RuntimeException error) {
    syncResponses.add(error);
    return this;
  }

  public StubChatModel streamWith(Flux<ChatResponse> response) {
    this.streamResponse = response;
    return this;
  }

  public List<Prompt> prompts() {
    return prompts;
  }

  @Override
  public ChatResponse call(Prompt prompt) {
    prompts.add(prompt);
    Object next;
    synchronized (this) {
      next = syncResponses.poll();
    }
    if (next instanceof RuntimeException error) {
      throw error;
    }
    if (next == null) {
      throw new IllegalStateException("No stub response queued");
    }
    return (ChatResponse) next;
  }

  @Override
  public Flux<ChatResponse> stream(Prompt prompt) {
    prompts.add(prompt);
    return streamResponse;
  }
}
