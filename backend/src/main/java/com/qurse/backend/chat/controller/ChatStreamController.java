package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.api.ChatStreamRequest;
import com.qurse.backend.chat.api.StopStreamRequest;
import com.qurse.backend.chat.api.StopStreamResponse;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.identity.IdentityResolver;
import com.qurse.backend.chat.ratelimit.RateLimitHeaders;
import com.qurse.backend.chat.service.ConversationIds;
import com.qurse.backend.chat.stream.CancellationCause;
import com.qurse.backend.chat.stream.GenerationTurn;
import com.qurse.backend.chat.stream.StreamOrchestrator;
import com.qurse.backend.chat.stream.TurnPreparer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/chat")
@Validated
@Slf4j
public class ChatStreamController {

  public static final String CONVERSATION_ID_HEADER = "X-Conversation-Id";

  private final IdentityResolver identityResolver;
  private final TurnPreparer turnPreparer;
  private final StreamOrchestrator streamOrchestrator;

  public ChatStreamController(
      IdentityResolver identityResolver,
      TurnPreparer turnPreparer,
      StreamOrchestrator streamOrchestrator) {
    this.identityResolver = identityResolver;
    this.turnPreparer = turnPreparer;
    this.streamOrchestrator = streamOrchestrator;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public ResponseEntity<SseEmitter> stream(
      @RequestBody @Valid ChatStreamRequest request,
      HttpServletRequest httpRequest,
      HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    GenerationTurn turn = turnPreparer.prepare(identity, request);

    SseEmitter emitter = new SseEmitter(0L);
    SseTurnEventSink sink = new SseTurnEventSink(emitter);
    emitter.onCompletion(
        () -> {
          sink.markClosed();
          streamOrchestrator.abort(turn, CancellationCause.REQUEST_ABORT);
        });
    emitter.onTimeout(
        () -> {
          log.debug("SSE timeout for conversation {}", turn.conversationId());
          streamOrchestrator.abort(turn, CancellationCause.REQUEST_ABORT);
        });
    emitter.onError(
        error -> {
          sink.markClosed();
          streamOrchestrator.abort(turn, CancellationCause.REQUEST_ABORT);
        });

    streamOrchestrator.stream(turn, sink);

    HttpHeaders headers = RateLimitHeaders.from(turn.rateLimit());
    headers.set(CONVERSATION_ID_HEADER, turn.conversationId().toString());
    headers.setCacheControl("no-cache");
    return ResponseEntity.ok().headers(headers).body(emitter);
  }

  @PostMapping(value = "/stop", consumes = MediaType.APPLICATION_JSON_VALUE)
  public StopStreamResponse stop(
      @RequestBody @Valid StopStreamRequest request,
      HttpServletRequest httpRequest,
      HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    boolean stopped =
        ConversationIds.durable(request.conversationId())
            .map(conversationId -> streamOrchestrator.stop(identity, conversationId))
            .orElse(false);
    return new StopStreamResponse(stopped);
  }
}
