package com.cario.contract.app.service;

import com.cario.contract.app.error.ExtractionException;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.prompt.PromptConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.victools.jsonschema.generator.Module;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.chat.prompt.SystemPromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

/**
 * LLM-backed contract field extraction.
 *
 * <p>Sends the detected document text with the loaded prompt templates and asks the model for a
 * JSON object shaped by a schema generated from {@link ContractDraft}. The schema is not strict:
 * every field may be missing or {@code null}.
 */
@Log4j2
public class ContractParserService {

  static final String SCHEMA_NAME = "ContractDraft";
  static final String TEXT_VARIABLE = "contract_text";

  private final ChatClient chat;
  private final PromptLoaderService promptLoader;
  private final String promptLocation;
  private final String model;
  private final double temperature;

  private final ObjectMapper om =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private final Map<String, Object> draftSchema;

  public ContractParserService(
      ChatClient chat,
      PromptLoaderService promptLoader,
      String promptLocation,
      String model,
      double temperature) {
    this.chat = chat;
    this.promptLoader = promptLoader;
    this.promptLocation = promptLocation;
    this.model = model;
    this.temperature = temperature;
    this.draftSchema = buildDraftSchemaFromPojo();
  }

  // ============================================================
  // Public API
  // ============================================================

  /**
   * Extracts a draft from contract text.
   *
   * @param contractText page-tagged document text
   * @return parsed draft; fields the model did not find are {@code null}
   * @throws ExtractionException TRANSIENT for provider hiccups and unusable responses, PERMANENT
   *     for requests the provider rejected outright
   */
  public ContractDraft parse(String contractText) {
    PromptConfig cfg = promptLoader.load(promptLocation);

    Map<String, Object> vars = new HashMap<>();
    if (cfg.getRules() != null) vars.putAll(cfg.getRules());
    vars.put(TEXT_VARIABLE, contractText);

    Message systemMsg = new SystemPromptTemplate(cfg.getSystemTemplate()).createMessage(vars);
    Message userMsg = new PromptTemplate(cfg.getUserTemplate()).createMessage(vars);

    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(model)
            .temperature(temperature)
            .responseFormat(
                ResponseFormat.builder()
                    .type(ResponseFormat.Type.JSON_SCHEMA)
                    .jsonSchema(
                        ResponseFormat.JsonSchema.builder()
                            .name(SCHEMA_NAME)
                            .schema(draftSchema)
                            .strict(false)
                            .build())
                    .build())
            .build();

    String json;
    try {
      json = chat.prompt().messages(List.of(systemMsg, userMsg)).options(options).call().content();
    } catch (NonTransientAiException e) {
      log.warn("parser.llm.rejected model={} msg={}", model, e.getMessage());
      throw ExtractionException.permanentFailure("LLM rejected request: " + e.getMessage(), e);
    } catch (TransientAiException e) {
      log.warn("parser.llm.transient model={} msg={}", model, e.getMessage());
      throw ExtractionException.transientFailure("LLM temporarily unavailable", e);
    } catch (RuntimeException e) {
      log.warn("parser.llm.error model={} msg={}", model, e.getMessage());
      throw ExtractionException.transientFailure("LLM call failed: " + e.getMessage(), e);
    }

    if (json == null || json.isBlank()) {
      throw ExtractionException.transientFailure("Empty response from LLM", null);
    }
    log.debug("parser.llm.rawJson={}", truncate(json, 1400));

    try {
      ContractDraft draft = om.readValue(stripCodeFence(json), ContractDraft.class);
      log.info("parser.done chars={} title={}", contractText.length(), draft.getContractTitle());
      return draft;
    } catch (JsonProcessingException e) {
      log.warn("parser.json.invalid msg={}", e.getOriginalMessage());
      throw ExtractionException.transientFailure("Failed to parse LLM response as JSON", e);
    }
  }

  // ============================================================
  // Schema helpers
  // ============================================================

  Map<String, Object> getDraftSchema() {
    return draftSchema;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> buildDraftSchemaFromPojo() {
    SchemaGeneratorConfigBuilder cfgBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON);
    Module jacksonModule = new JacksonModule();
    cfgBuilder.with(jacksonModule);

    SchemaGenerator generator = new SchemaGenerator(cfgBuilder.build());
    JsonNode schemaNode = generator.generateSchema(ContractDraft.class);

    Map<String, Object> schema =
        om.convertValue(schemaNode, new TypeReference<Map<String, Object>>() {});
    schema.remove("$schema");
    schema.remove("$id");
    schema.put("type", "object");

    // raw text is attached after parsing, never asked from the model
    Object props = schema.get("properties");
    if (props instanceof Map<?, ?> propsMap) {
      ((Map<String, Object>) propsMap).remove("extracted_text");
    }
    return schema;
  }

  private static String stripCodeFence(String s) {
    String t = s.strip();
    if (!t.startsWith("```")) return t;
    int firstNewline = t.indexOf('\n');
    int lastFence = t.lastIndexOf("```");
    if (firstNewline < 0 || lastFence <= firstNewline) return t;
    return t.substring(firstNewline + 1, lastFence).strip();
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max) + "...";
  }
}
