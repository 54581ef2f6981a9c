package com.qurse.backend.chat.stream;

public enum CancellationCause {
  /** The inbound connection closed or could no longer be written to. */
  REQUEST_ABORT,
  /** The caller asked to stop through the stop endpoint. */
  BRIDGE_ABORT,
  /** The provider ended the stream, for example after rejecting the credentials. */
  GENERATOR_ABORT
}
