package com.flamingo.ai.devicerag.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("GET", "/api/devices/device-1/documents/doc-1");
  }

  private double errors(String type) {
    return meterRegistry.counter("api_errors_total", "error_type", type).count();
  }

  @Nested
  @DisplayName("Not found errors")
  class NotFound {

    @Test
    @DisplayName("should map a missing document to 404")
    void shouldMapMissingDocument() {
      ResponseEntity<ApiError> response =
          handler.handleDocumentNotFound(
              new DocumentNotFoundException("device-1", "doc-1"), request);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getCode()).isEqualTo(ApiError.DOCUMENT_NOT_FOUND);
      assertThat(response.getBody().getPath())
          .isEqualTo("/api/devices/device-1/documents/doc-1");
      assertThat(response.getBody().getErrorId()).hasSize(8);
      assertThat(response.getBody().getTimestamp()).isNotNull();
      assertThat(errors("document_not_found")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should map a missing filled template to 404")
    void shouldMapMissingFilledTemplate() {
      ResponseEntity<ApiError> response =
          handler.handleFilledTemplateNotFound(
              new FilledTemplateNotFoundException("ref-1"), request);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getCode()).isEqualTo(ApiError.TEMPLATE_OUTPUT_NOT_FOUND);
    }
  }

  @Nested
  @DisplayName("Processing errors")
  class Processing {

    @Test
    @DisplayName("should expose the user message of a processing failure")
    void shouldExposeUserMessage() {
      ResponseEntity<ApiError> response =
          handler.handleDocumentProcessing(
              new DocumentProcessingException("doc-1", "tika failed", "File is corrupt"),
              request);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.getBody().getMessage()).isEqualTo("File is corrupt");
      assertThat(errors("document_processing")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should map a template parse failure to 422")
    void shouldMapTemplateParseFailure() {
      ResponseEntity<ApiError> response =
          handler.handleTemplateParse(new TemplateParseException("t.docx", "empty"), request);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.getBody().getCode()).isEqualTo(ApiError.TEMPLATE_PARSE_ERROR);
    }
  }

  @Nested
  @DisplayName("Upstream errors")
  class Upstream {

    @Test
    @DisplayName("should distinguish rate limiting from other model failures")
    void shouldDistinguishRateLimiting() {
      ResponseEntity<ApiError> limited =
          handler.handleLlmService(
              new LlmServiceException("429", true, Duration.ofSeconds(2), null), request);
      ResponseEntity<ApiError> down =
          handler.handleLlmService(new LlmServiceException("timeout"), request);

      assertThat(limited.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
      assertThat(limited.getBody().getCode()).isEqualTo(ApiError.LLM_RATE_LIMITED);
      assertThat(down.getBody().getCode()).isEqualTo(ApiError.LLM_UNAVAILABLE);
      assertThat(errors("llm_rate_limited")).isEqualTo(1.0);
      assertThat(errors("llm_error")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should map search failures to 503")
    void shouldMapSearchFailure() {
      ResponseEntity<ApiError> response =
          handler.handleSearch(new SearchException("index missing"), request);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
      assertThat(response.getBody().getCode()).isEqualTo(ApiError.SEARCH_FAILED);
    }
  }

  @Test
  @DisplayName("should map illegal arguments to 400 with the exception message")
  void shouldMapIllegalArgument() {
    ResponseEntity<ApiError> response =
        handler.handleIllegalArgument(new IllegalArgumentException("deviceId is blank"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getMessage()).isEqualTo("deviceId is blank");
  }

  @Test
  @DisplayName("should hide details of unexpected errors")
  void shouldHideUnexpectedErrorDetails() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("secret detail"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret detail");
    assertThat(errors("internal_error")).isEqualTo(1.0);
  }
}
