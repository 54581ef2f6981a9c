package com.qurse.backend.chat.config;

public enum ChatProviderType {
  OPENAI
}
