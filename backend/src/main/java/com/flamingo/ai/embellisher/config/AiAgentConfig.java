package com.flamingo.ai.embellisher.config;

import com.flamingo.ai.embellisher.agent.FlashcardGenerationAgent;
import com.flamingo.ai.embellisher.agent.LatexConversionAgent;
import com.flamingo.ai.embellisher.agent.NoteEnhancementAgent;
import com.flamingo.ai.embellisher.agent.TopicSuggestionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Agents returning records use the JSON-mode {@code chatModel}; agents returning free text use
 * {@code textChatModel}.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public NoteEnhancementAgent noteEnhancementAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(NoteEnhancementAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public LatexConversionAgent latexConversionAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(LatexConversionAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public TopicSuggestionAgent topicSuggestionAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(TopicSuggestionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public FlashcardGenerationAgent flashcardGenerationAgent(
      @Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(FlashcardGenerationAgent.class).chatModel(chatModel).build();
  }
}
