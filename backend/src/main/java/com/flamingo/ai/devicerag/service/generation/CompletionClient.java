package com.flamingo.ai.devicerag.service.generation;

import com.flamingo.ai.devicerag.exception.LlmServiceException;

/** Contract of the external generative completion service. */
public interface CompletionClient {

  /**
   * Completes a prompt.
   *
   * @param request prompt, temperature and token limit
   * @return the generated text
   * @throws LlmServiceException when the service fails; {@link LlmServiceException#isRateLimited()}
   *     marks throttling, optionally with a retry-after hint
   */
  String complete(CompletionRequest request);
}
