package com.qurse.backend.chat.stream;

import reactor.core.publisher.Flux;

/** Streaming language-model provider. */
public interface ChatGenerator {

  /**
   * Streams the answer to {@code request}. The stream terminates with a {@code FINISH} chunk, an
   * error, or nothing at all once the bridge is cancelled. Provider-initiated aborts are signalled
   * as {@link GeneratorAbortException}.
   */
  Flux<GenerationChunk> stream(GenerationRequest request, CancellationBridge bridge);
}
