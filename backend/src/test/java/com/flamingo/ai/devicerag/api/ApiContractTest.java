package com.flamingo.ai.devicerag.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.devicerag.api.rest.ChatController;
import com.flamingo.ai.devicerag.api.rest.DocumentController;
import com.flamingo.ai.devicerag.api.rest.HealthController;
import com.flamingo.ai.devicerag.api.rest.TemplateController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the controller mappings. Paths are relative to the {@code /api} servlet
 * context path:
 *
 * <ul>
 *   <li>POST /api/devices/{deviceId}/documents - Upload documents
 *   <li>POST /api/devices/{deviceId}/chat - Ask a question
 *   <li>POST /api/devices/{deviceId}/templates/fill - Fill a template
 *   <li>GET /api/templates/output/{reference} - Download a filled template
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped to /devices/{deviceId}/documents")
    void shouldBeMappedToDeviceDocuments() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/devices/{deviceId}/documents");
    }
  }

  @Nested
  @DisplayName("ChatController API contract")
  class ChatControllerContract {

    @Test
    @DisplayName("should be mapped to /devices/{deviceId}/chat")
    void shouldBeMappedToDeviceChat() {
      RequestMapping mapping = ChatController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/devices/{deviceId}/chat");
    }
  }

  @Nested
  @DisplayName("TemplateController API contract")
  class TemplateControllerContract {

    @Test
    @DisplayName("should expose analyze and fill under the device")
    void shouldExposeAnalyzeAndFill() {
      assertThat(
              Arrays.stream(TemplateController.class.getDeclaredMethods())
                  .map(m -> m.getAnnotation(PostMapping.class))
                  .filter(m -> m != null)
                  .flatMap(m -> Arrays.stream(m.value())))
          .containsExactlyInAnyOrder(
              "/devices/{deviceId}/templates/analyze", "/devices/{deviceId}/templates/fill");
    }

    @Test
    @DisplayName("should expose the download of filled templates")
    void shouldExposeDownload() throws NoSuchMethodException {
      Method download = TemplateController.class.getMethod("download", String.class);
      assertThat(download.getAnnotation(GetMapping.class).value())
          .containsExactly("/templates/output/{reference}");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
