package com.flamingo.ai.devicerag.service.generation;

import com.flamingo.ai.devicerag.exception.LlmServiceException;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link CompletionClient} backed by a LangChain4j {@link ChatModel}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jCompletionClient implements CompletionClient {

  private static final Pattern RETRY_AFTER =
      Pattern.compile(
          "(?i)(?:retry[- ]after|try again in)\\s*:?\\s*"
              + "(\\d+(?:\\.\\d+)?)\\s*(ms|s|sec|seconds?)?");

  private final ChatModel chatModel;

  @Override
  public String complete(CompletionRequest request) {
    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(UserMessage.from(request.prompt()))
            .temperature(request.temperature())
            .maxOutputTokens(request.maxTokens())
            .build();
    try {
      ChatResponse response = chatModel.chat(chatRequest);
      String text = response.aiMessage().text();
      log.debug("Completion returned {} chars", text == null ? 0 : text.length());
      return text == null ? "" : text;
    } catch (RateLimitException e) {
      Duration retryAfter = parseRetryAfter(e.getMessage());
      log.warn("Completion throttled (retry after {}): {}", retryAfter, e.getMessage());
      throw new LlmServiceException("Completion throttled: " + e.getMessage(), true, retryAfter, e);
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LlmServiceException("Completion call failed: " + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  static Duration parseRetryAfter(String message) {
    if (message == null) {
      return null;
    }
    Matcher matcher = RETRY_AFTER.matcher(message);
    if (!matcher.find()) {
      return null;
    }
    double amount = Double.parseDouble(matcher.group(1));
    String unit = matcher.group(2);
    if ("ms".equalsIgnoreCase(unit)) {
      return Duration.ofMillis((long) amount);
    }
    return Duration.ofMillis((long) (amount * 1000));
  }
}
