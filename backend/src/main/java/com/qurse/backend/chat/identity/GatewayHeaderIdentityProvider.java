package com.qurse.backend.chat.identity;

import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Trusts user headers set by the upstream gateway, provided the request also carries the
 * gateway's shared token.
 */
public class GatewayHeaderIdentityProvider implements IdentityProvider {

  private static final Logger log = LoggerFactory.getLogger(GatewayHeaderIdentityProvider.class);

  private final IdentityProperties properties;

  public GatewayHeaderIdentityProvider(IdentityProperties properties) {
    this.properties = properties;
    if (!StringUtils.hasText(properties.getGatewayToken())) {
      log.warn("Gateway token is not configured, every caller is treated as anonymous");
    }
  }

  @Override
  public Optional<AuthenticatedUser> authenticate(HttpServletRequest request) {
    String userId = request.getHeader(properties.getUserIdHeader());
    if (!StringUtils.hasText(userId)) {
      return Optional.empty();
    }
    if (!gatewayTokenMatches(request.getHeader(properties.getGatewayTokenHeader()))) {
      log.debug("Ignoring {} header without a valid gateway token", properties.getUserIdHeader());
      return Optional.empty();
    }
    String plan = request.getHeader(properties.getPlanHeader());
    boolean entitled =
        StringUtils.hasText(plan)
            && properties.getEntitledPlans().stream()
                .anyMatch(candidate -> candidate.equalsIgnoreCase(plan.trim()));
    return Optional.of(new AuthenticatedUser(userId.trim(), entitled));
  }

  private boolean gatewayTokenMatches(String header) {
    String configured = properties.getGatewayToken();
    if (!StringUtils.hasText(configured) || !StringUtils.hasText(header)) {
      return false;
    }
    return MessageDigest.isEqual(
        configured.getBytes(StandardCharsets.UTF_8),
        header.trim().getBytes(StandardCharsets.UTF_8));
  }
}
