package com.qurse.backend.chat.stream;

public enum TurnState {
  GATED,
  CONVERSATION_ENSURING,
  USER_SAVED,
  STREAMING,
  COMPLETED,
  ABORTED,
  ERRORED,
  ASSISTANT_SAVE_DECISION,
  DONE
}
