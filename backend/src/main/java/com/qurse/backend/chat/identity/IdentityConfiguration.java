package com.qurse.backend.chat.identity;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class IdentityConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public IdentityProvider identityProvider(IdentityProperties properties) {
    return new GatewayHeaderIdentityProvider(properties);
  }

  @Bean
  public SessionHasher sessionHasher(IdentityProperties properties) {
    return new SessionHasher(properties.getSessionSecret());
  }

  @Bean
  public IdentityResolver identityResolver(
      IdentityProvider identityProvider, SessionHasher sessionHasher, IdentityProperties properties) {
    return new IdentityResolver(identityProvider, sessionHasher, properties);
  }
}
