package com.qurse.backend.chat.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.support.StubChatProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatProviderRegistryTest {

  private ChatProvidersProperties properties;
  private ChatProviderRegistry registry;

  @BeforeEach
  void setUp() {
    properties = StubChatProviders.properties();
    ChatProvidersProperties.Provider secondary = new ChatProvidersProperties.Provider();
    secondary.setDefaultModel("other/model");
    secondary.getModels().put("other/model", new ChatProvidersProperties.Model());
    secondary.getModels().put(StubChatProviders.MODEL, new ChatProvidersProperties.Model());
    properties.getProviders().put("secondary", secondary);
    registry = new ChatProviderRegistry(properties);
  }

  @Test
  void blankModelResolvesToConfiguredDefault() {
    assertThat(registry.findSelection(" "))
        .contains(new ChatProviderSelection(StubChatProviders.PROVIDER, StubChatProviders.MODEL));
  }

  @Test
  void defaultProviderWinsWhenSeveralServeTheModel() {
    ChatProvidersProperties.Provider stub =
        properties.getProviders().remove(StubChatProviders.PROVIDER);
    properties.getProviders().put(StubChatProviders.PROVIDER, stub);

    assertThat(registry.findSelection(StubChatProviders.MODEL))
        .contains(new ChatProviderSelection(StubChatProviders.PROVIDER, StubChatProviders.MODEL));
    assertThat(registry.findSelection("other/model"))
        .contains(new ChatProviderSelection("secondary", "other/model"));
  }

  @Test
  void unknownModelIsNotFound() {
    assertThat(registry.findSelection("missing/model")).isEmpty();
  }

  @Test
  void resolveSelectionFallsBackToProviderDefaultModel() {
    assertThat(registry.resolveSelection("secondary", null))
        .isEqualTo(new ChatProviderSelection("secondary", "other/model"));
    assertThatThrownBy(() -> registry.resolveSelection("secondary", "stub/small"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requireModelRejectsUnknownProvider() {
    assertThatThrownBy(() -> registry.requireModel(new ChatProviderSelection("ghost", "x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ghost");
  }
}
