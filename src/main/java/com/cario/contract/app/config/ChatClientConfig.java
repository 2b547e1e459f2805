package com.cario.contract.app.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI chat configuration.
 *
 * <p>Provides the {@link ChatClient.Builder} used by {@code ContractParserService}. The {@link
 * OpenAiChatModel} is autoconfigured from {@code spring.ai.openai.*} (api key, retry settings).
 */
@Configuration
public class ChatClientConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }
}
