package com.qurse.backend.chat.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.qurse.backend.chat.api.GuestTransferResponse;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.identity.IdentityResolver;
import com.qurse.backend.chat.service.GuestTransferService;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(GuestTransferController.class)
@AutoConfigureMockMvc(addFilters = false)
class GuestTransferControllerTest {

  private static final CallerIdentity USER = CallerIdentity.user("user-5", false, "198.51.100.1");

  @Autowired private MockMvc mockMvc;

  @MockBean private IdentityResolver identityResolver;
  @MockBean private GuestTransferService guestTransferService;

  @Test
  void transfersPresentedSessionToSignedInUser() throws Exception {
    when(identityResolver.resolve(any(), any())).thenReturn(USER);
    when(identityResolver.presentedSessionHash(any())).thenReturn(Optional.of("hash-5"));
    when(guestTransferService.transfer("hash-5", "user-5"))
        .thenReturn(new GuestTransferResponse(2, 1));

    mockMvc
        .perform(post("/api/identity/guest-transfer"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conversationsTransferred").value(2))
        .andExpect(jsonPath("$.rateLimitWindowsTransferred").value(1));
  }

  @Test
  void guestCallerIsRejected() throws Exception {
    when(identityResolver.resolve(any(), any()))
        .thenReturn(CallerIdentity.guest("session-5", "hash-5", "198.51.100.1"));

    mockMvc
        .perform(post("/api/identity/guest-transfer"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").exists());

    verify(guestTransferService, never()).transfer(anyString(), anyString());
  }

  @Test
  void missingSessionCookieTransfersNothing() throws Exception {
    when(identityResolver.resolve(any(), any())).thenReturn(USER);
    when(identityResolver.presentedSessionHash(any())).thenReturn(Optional.empty());

    mockMvc
        .perform(post("/api/identity/guest-transfer"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conversationsTransferred").value(0));

    verify(guestTransferService, never()).transfer(anyString(), anyString());
  }
}
