package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.api.ChatStreamEvent;

/** Outbound side of a turn, usually an SSE connection. */
public interface TurnEventSink {

  TurnEventSink NOOP =
      new TurnEventSink() {
        @Override
        public boolean send(ChatStreamEvent event) {
          return false;
        }

        @Override
        public void complete() {}
      };

  /** Returns false when the event could not be delivered because the caller is gone. */
  boolean send(ChatStreamEvent event);

  void complete();
}
