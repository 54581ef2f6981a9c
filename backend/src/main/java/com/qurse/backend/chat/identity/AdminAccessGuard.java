package com.qurse.backend.chat.identity;

import com.qurse.backend.common.exception.AccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Shared-token check for the administrative endpoints. */
@Component
@Slf4j
public class AdminAccessGuard {

  private final IdentityProperties properties;

  public AdminAccessGuard(IdentityProperties properties) {
    this.properties = properties;
  }

  public void ensureAdmin(HttpServletRequest request) {
    String configuredToken = properties.getAdminToken();
    if (!StringUtils.hasText(configuredToken)) {
      log.warn("Admin endpoint called but no admin token is configured");
      throw AccessDeniedException.forbidden("Admin access is disabled");
    }
    String header = request.getHeader(properties.getAdminTokenHeader());
    if (!StringUtils.hasText(header)
        || !MessageDigest.isEqual(
            configuredToken.getBytes(StandardCharsets.UTF_8),
            header.trim().getBytes(StandardCharsets.UTF_8))) {
      throw AccessDeniedException.authenticationRequired("Invalid or missing admin token");
    }
  }
}
