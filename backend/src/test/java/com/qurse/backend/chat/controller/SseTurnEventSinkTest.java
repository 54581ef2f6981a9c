package com.qurse.backend.chat.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.qurse.backend.chat.api.ChatStreamEvent;
import java.io.IOException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class SseTurnEventSinkTest {

  private final UUID conversationId = UUID.randomUUID();

  @Test
  void sendsEventsUntilTheConnectionFails() throws Exception {
    SseEmitter emitter = mock(SseEmitter.class);
    SseTurnEventSink sink = new SseTurnEventSink(emitter);

    assertThat(sink.send(ChatStreamEvent.start(conversationId))).isTrue();

    doThrow(new IOException("Broken pipe"))
        .when(emitter)
        .send(any(SseEmitter.SseEventBuilder.class));
    assertThat(sink.send(ChatStreamEvent.textDelta(conversationId, "Hi"))).isFalse();
    assertThat(sink.send(ChatStreamEvent.textDelta(conversationId, "there"))).isFalse();

    verify(emitter, times(2)).send(any(SseEmitter.SseEventBuilder.class));
  }

  @Test
  void completedEmitterRejectsFurtherEvents() throws Exception {
    SseEmitter emitter = mock(SseEmitter.class);
    doThrow(new IllegalStateException("ResponseBodyEmitter has already completed"))
        .when(emitter)
        .send(any(SseEmitter.SseEventBuilder.class));

    assertThat(new SseTurnEventSink(emitter).send(ChatStreamEvent.start(conversationId))).isFalse();
  }

  @Test
  void completesEmitterOnlyOnce() {
    SseEmitter emitter = mock(SseEmitter.class);
    SseTurnEventSink sink = new SseTurnEventSink(emitter);

    sink.complete();
    sink.complete();

    verify(emitter, times(1)).complete();
  }

  @Test
  void closedConnectionIsNeitherWrittenNorCompleted() throws Exception {
    SseEmitter emitter = mock(SseEmitter.class);
    SseTurnEventSink sink = new SseTurnEventSink(emitter);

    sink.markClosed();

    assertThat(sink.send(ChatStreamEvent.start(conversationId))).isFalse();
    sink.complete();
    verify(emitter, never()).send(any(SseEmitter.SseEventBuilder.class));
    verify(emitter, never()).complete();
  }
}
