package com.cario.contract.app.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/**
 * Prompt templates for contract extraction. Templates use {@code {name}} placeholders; {@code
 * rules} entries are exposed to both templates as variables.
 */
@Data
public class PromptConfig {
  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules;
}
