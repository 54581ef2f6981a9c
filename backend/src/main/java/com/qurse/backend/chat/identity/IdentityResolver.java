package com.qurse.backend.chat.identity;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller once per request. The result is cached as a request attribute so that
 * later lookups within the same request never reach the identity provider again.
 */
public class IdentityResolver {

  static final String REQUEST_ATTRIBUTE = IdentityResolver.class.getName() + ".identity";
  static final String UNKNOWN_IP = "unknown";

  private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
  private static final Pattern IPV6 = Pattern.compile("^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");
  private static final Pattern IPV6_MAPPED =
      Pattern.compile("^::ffff:((\\d{1,3}\\.){3}\\d{1,3})$", Pattern.CASE_INSENSITIVE);

  private final IdentityProvider identityProvider;
  private final SessionHasher sessionHasher;
  private final IdentityProperties properties;

  public IdentityResolver(
      IdentityProvider identityProvider,
      SessionHasher sessionHasher,
      IdentityProperties properties) {
    this.identityProvider = identityProvider;
    this.sessionHasher = sessionHasher;
    this.properties = properties;
  }

  public CallerIdentity resolve(HttpServletRequest request, HttpServletResponse response) {
    Object cached = request.getAttribute(REQUEST_ATTRIBUTE);
    if (cached instanceof CallerIdentity identity) {
      return identity;
    }
    CallerIdentity identity = doResolve(request, response);
    request.setAttribute(REQUEST_ATTRIBUTE, identity);
    return identity;
  }

  /** Hash of the anonymous session cookie the request carries, without issuing a new one. */
  public Optional<String> presentedSessionHash(HttpServletRequest request) {
    String sessionId = readSessionCookie(request);
    return StringUtils.hasText(sessionId)
        ? Optional.of(sessionHasher.hash(sessionId))
        : Optional.empty();
  }

  private CallerIdentity doResolve(HttpServletRequest request, HttpServletResponse response) {
    String clientIp = clientIp(request);
    Optional<AuthenticatedUser> user = identityProvider.authenticate(request);
    if (user.isPresent()) {
      return CallerIdentity.user(user.get().userId(), user.get().entitled(), clientIp);
    }
    String sessionId = readSessionCookie(request);
    if (!StringUtils.hasText(sessionId)) {
      sessionId = UUID.randomUUID().toString();
      if (response != null) {
        ResponseCookie cookie =
            ResponseCookie.from(properties.getSessionCookie(), sessionId)
                .httpOnly(true)
                .sameSite("Lax")
                .path("/")
                .maxAge(properties.getSessionCookieMaxAge())
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
      }
    }
    return CallerIdentity.guest(sessionId, sessionHasher.hash(sessionId), clientIp);
  }

  private String readSessionCookie(HttpServletRequest request) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (properties.getSessionCookie().equals(cookie.getName())
          && StringUtils.hasText(cookie.getValue())) {
        return cookie.getValue().trim();
      }
    }
    return null;
  }

  /**
   * First forwarded address, then {@code X-Real-IP}, then the socket peer. Values that are not an
   * IPv4 or IPv6 literal are ignored, and {@value #UNKNOWN_IP} is returned when nothing is left.
   */
  static String clientIp(HttpServletRequest request) {
    String forwarded = request.getHeader("X-Forwarded-For");
    if (StringUtils.hasText(forwarded)) {
      String first = forwarded.split(",")[0].trim();
      if (isValidIp(first)) {
        return first;
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    if (StringUtils.hasText(realIp) && isValidIp(realIp.trim())) {
      return realIp.trim();
    }
    String remote = request.getRemoteAddr();
    return isValidIp(remote) ? remote : UNKNOWN_IP;
  }

  static boolean isValidIp(String candidate) {
    if (!StringUtils.hasText(candidate)) {
      return false;
    }
    Matcher mapped = IPV6_MAPPED.matcher(candidate);
    if (mapped.matches()) {
      return isValidIpv4(mapped.group(1));
    }
    return isValidIpv4(candidate) || IPV6.matcher(candidate).matches();
  }

  private static boolean isValidIpv4(String candidate) {
    if (!IPV4.matcher(candidate).matches()) {
      return false;
    }
    for (String octet : candidate.split("\\.")) {
      if (Integer.parseInt(octet) > 255) {
        return false;
      }
    }
    return true;
  }
}
