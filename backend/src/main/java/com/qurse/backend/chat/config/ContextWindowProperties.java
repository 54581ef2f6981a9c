package com.qurse.backend.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.context")
public class ContextWindowProperties {

  /** Share of the model context window the prompt may occupy. */
  private int budgetPercent = 75;

  /** Most recent messages that keep their reasoning parts. */
  private int keepReasoningCount = 3;

  /** Messages kept even when the budget is still exceeded. */
  private int minMessagesKeep = 5;

  private String defaultTokenizer = "cl100k_base";

  public int getBudgetPercent() {
    return budgetPercent;
  }

  public void setBudgetPercent(int budgetPercent) {
    this.budgetPercent = budgetPercent;
  }

  public int getKeepReasoningCount() {
    return keepReasoningCount;
  }

  public void setKeepReasoningCount(int keepReasoningCount) {
    this.keepReasoningCount = keepReasoningCount;
  }

  public int getMinMessagesKeep() {
    return minMessagesKeep;
  }

  public void setMinMessagesKeep(int minMessagesKeep) {
    this.minMessagesKeep = minMessagesKeep;
  }

  public String getDefaultTokenizer() {
    return defaultTokenizer;
  }

  public void setDefaultTokenizer(String defaultTokenizer) {
    this.defaultTokenizer = defaultTokenizer;
  }
}
