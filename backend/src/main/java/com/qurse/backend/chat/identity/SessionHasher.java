package com.qurse.backend.chat.identity;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.util.Assert;

/** Derives the stored owner key of an anonymous session. Raw session ids are never persisted. */
public class SessionHasher {

  private static final String ALGORITHM = "HmacSHA256";

  private final SecretKeySpec key;

  public SessionHasher(String secret) {
    Assert.hasText(secret, "app.identity.session-secret must be configured");
    this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
  }

  public String hash(String sessionId) {
    Assert.hasText(sessionId, "sessionId must not be blank");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      byte[] digest = mac.doFinal(sessionId.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    } catch (GeneralSecurityException exception) {
      throw new IllegalStateException("Failed to hash session id", exception);
    }
  }
}
