package com.qurse.backend.chat.identity;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Authentication backend. Returns empty for anonymous callers. */
public interface IdentityProvider {

  Optional<AuthenticatedUser> authenticate(HttpServletRequest request);
}
