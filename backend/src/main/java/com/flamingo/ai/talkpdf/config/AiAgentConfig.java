package com.flamingo.ai.talkpdf.config;

import com.flamingo.ai.talkpdf.agent.TranslationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for reusable AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Translation agent. Uses textChatModel (no JSON response format) for free-form output. */
  @Bean
  public TranslationAgent translationAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TranslationAgent.class).chatModel(textChatModel).build();
  }
}
