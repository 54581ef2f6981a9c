package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.api.ChatStreamEvent;
import com.qurse.backend.chat.stream.TurnEventSink;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes turn events to an {@link SseEmitter}, one named SSE event per stream event. */
class SseTurnEventSink implements TurnEventSink {

  private static final Logger log = LoggerFactory.getLogger(SseTurnEventSink.class);

  private final SseEmitter emitter;
  private final AtomicBoolean closed = new AtomicBoolean();

  SseTurnEventSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public boolean send(ChatStreamEvent event) {
    if (closed.get()) {
      return false;
    }
    try {
      emitter.send(SseEmitter.event().name(event.type()).data(event));
      return true;
    } catch (IOException ioException) {
      log.debug(
          "Failed to send SSE event {} for conversation {}: {}",
          event.type(),
          event.conversationId(),
          ioException.getMessage());
      closed.set(true);
      return false;
    } catch (IllegalStateException alreadyCompleted) {
      closed.set(true);
      return false;
    }
  }

  @Override
  public void complete() {
    if (closed.compareAndSet(false, true)) {
      emitter.complete();
    }
  }

  /** Marks the connection gone without completing the emitter a second time. */
  void markClosed() {
    closed.set(true);
  }
}
