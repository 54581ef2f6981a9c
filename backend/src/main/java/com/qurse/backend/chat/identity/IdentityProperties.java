package com.qurse.backend.chat.identity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.identity")
public class IdentityProperties {

  /**
   * Shared secret the upstream gateway sends with authenticated requests. User headers are
   * ignored unless it matches.
   */
  private String gatewayToken;

  private String gatewayTokenHeader = "X-Gateway-Auth";
  private String userIdHeader = "X-User-Id";
  private String planHeader = "X-User-Plan";

  /** Plan names that grant the paid tier. */
  private List<String> entitledPlans = new ArrayList<>(List.of("pro"));

  private String sessionCookie = "session_id";
  private Duration sessionCookieMaxAge = Duration.ofDays(30);

  /** Key for hashing anonymous session ids before they are stored. */
  private String sessionSecret;

  /** Token required by the administrative endpoints. Unset disables them. */
  private String adminToken;

  private String adminTokenHeader = "X-Admin-Token";

  public String getGatewayToken() {
    return gatewayToken;
  }

  public void setGatewayToken(String gatewayToken) {
    this.gatewayToken = gatewayToken;
  }

  public String getGatewayTokenHeader() {
    return gatewayTokenHeader;
  }

  public void setGatewayTokenHeader(String gatewayTokenHeader) {
    this.gatewayTokenHeader = gatewayTokenHeader;
  }

  public String getUserIdHeader() {
    return userIdHeader;
  }

  public void setUserIdHeader(String userIdHeader) {
    this.userIdHeader = userIdHeader;
  }

  public String getPlanHeader() {
    return planHeader;
  }

  public void setPlanHeader(String planHeader) {
    this.planHeader = planHeader;
  }

  public List<String> getEntitledPlans() {
    return entitledPlans;
  }

  public void setEntitledPlans(List<String> entitledPlans) {
    this.entitledPlans = entitledPlans;
  }

  public String getSessionCookie() {
    return sessionCookie;
  }

  public void setSessionCookie(String sessionCookie) {
    this.sessionCookie = sessionCookie;
  }

  public Duration getSessionCookieMaxAge() {
    return sessionCookieMaxAge;
  }

  public void setSessionCookieMaxAge(Duration sessionCookieMaxAge) {
    this.sessionCookieMaxAge = sessionCookieMaxAge;
  }

  public String getSessionSecret() {
    return sessionSecret;
  }

  public void setSessionSecret(String sessionSecret) {
    this.sessionSecret = sessionSecret;
  }

  public String getAdminToken() {
    return adminToken;
  }

  public void setAdminToken(String adminToken) {
    this.adminToken = adminToken;
  }

  public String getAdminTokenHeader() {
    return adminTokenHeader;
  }

  public void setAdminTokenHeader(String adminTokenHeader) {
    this.adminTokenHeader = adminTokenHeader;
  }
}
