package com.flamingo.ai.talkpdf;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.talkpdf.service.llm.OpenAiDocumentChatModel;
import com.flamingo.ai.talkpdf.service.pipeline.DocumentIntakeService;
import com.flamingo.ai.talkpdf.service.pipeline.DocumentPipelineService;
import com.flamingo.ai.talkpdf.service.tts.TtsFallbackEngine;
import com.flamingo.ai.talkpdf.service.tts.TtsProvider;
import com.flamingo.ai.talkpdf.service.usage.UsageAccountingService;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The analysis and translation models are mocked;
 * the document model is built for real but never called.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "chatModel")
  private ChatModel chatModel;

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans and all three speech providers should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentIntakeService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentPipelineService.class)).isNotNull();
    assertThat(applicationContext.getBean(TtsFallbackEngine.class)).isNotNull();
    assertThat(applicationContext.getBean(UsageAccountingService.class)).isNotNull();
    assertThat(applicationContext.getBeansOfType(TtsProvider.class)).hasSize(3);
  }

  @Test
  @DisplayName("Extraction should use the file-capable document model")
  void documentChatModelShouldCarryFiles() {
    assertThat(applicationContext.getBean("documentChatModel"))
        .isInstanceOf(OpenAiDocumentChatModel.class);
  }
}
