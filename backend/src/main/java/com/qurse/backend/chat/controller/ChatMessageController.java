package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.api.ConversationMessagesResponse;
import com.qurse.backend.chat.api.MessageSaveResponse;
import com.qurse.backend.chat.api.StoppedMessageRequest;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.identity.IdentityResolver;
import com.qurse.backend.chat.service.ConversationMessageService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Validated
public class ChatMessageController {

  private final IdentityResolver identityResolver;
  private final ConversationMessageService messageService;

  public ChatMessageController(
      IdentityResolver identityResolver, ConversationMessageService messageService) {
    this.identityResolver = identityResolver;
    this.messageService = messageService;
  }

  @PostMapping(value = "/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
  public MessageSaveResponse saveStopped(
      @RequestBody @Valid StoppedMessageRequest request,
      HttpServletRequest httpRequest,
      HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    return messageService.saveStopped(identity.owner(), request);
  }

  @GetMapping("/conversations/{conversationId}/messages")
  public ConversationMessagesResponse history(
      @PathVariable String conversationId,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset,
      HttpServletRequest httpRequest,
      HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    return messageService.history(identity.owner(), conversationId, limit, offset);
  }
}
