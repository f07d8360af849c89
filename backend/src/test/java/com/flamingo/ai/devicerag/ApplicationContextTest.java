package com.flamingo.ai.devicerag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.devicerag.service.chat.ChatService;
import com.flamingo.ai.devicerag.service.document.DocumentService;
import com.flamingo.ai.devicerag.service.rag.search.MultiQueryRetriever;
import com.flamingo.ai.devicerag.service.template.TemplateFillService;
import com.flamingo.ai.devicerag.vectorstore.InMemoryVectorStore;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads with the in-memory vector store. The model beans
 * are mocked so no API key or running service is needed.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(ChatService.class)).isNotNull();
    assertThat(applicationContext.getBean(MultiQueryRetriever.class)).isNotNull();
    assertThat(applicationContext.getBean(TemplateFillService.class)).isNotNull();
  }

  @Test
  @DisplayName("The memory vector store should be selected")
  void memoryVectorStoreShouldBeSelected() {
    assertThat(applicationContext.getBean(VectorStore.class))
        .isInstanceOf(InMemoryVectorStore.class);
  }
}
