package com.cario.contract.app.service;

import com.cario.contract.app.prompt.PromptConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.IOUtils;
import org.springframework.core.io.ClassPathResource;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/**
 * Loads {@link PromptConfig}s from {@code classpath:} or {@code s3://bucket/key} locations.
 *
 * <p>YAML is tried first, then JSON. Loaded configs are cached per location.
 */
@Log4j2
@RequiredArgsConstructor
public class PromptLoaderService {

  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final String S3_PREFIX = "s3://";

  private final S3Client s3Client;

  // YAML + JSON mappers
  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();

  private final Map<String, PromptConfig> cache = new ConcurrentHashMap<>();

  public PromptConfig load(String location) {
    Objects.requireNonNull(location, "location");
    return cache.computeIfAbsent(location, this::loadUncached);
  }

  private PromptConfig loadUncached(String location) {
    String raw;
    try {
      raw = readRaw(location);
    } catch (Exception e) {
      log.error("prompt.load error location={}", location, e);
      throw new IllegalStateException("Failed to load prompts from " + location, e);
    }

    // Try YAML first
    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      PromptConfig cfg = new PromptConfig();
      cfg.setSystemTemplate(asString(map.get("system")));
      cfg.setUserTemplate(asString(map.get("user")));
      cfg.setRules(toStringMap(map.get("rules")));
      log.info("prompt.loaded location={} format=yaml", location);
      return cfg;
    } catch (Exception yamlErr) {
      log.warn("prompt.yaml.invalid location={} reason={}", location, yamlErr.getMessage());
    }

    // Fallback: JSON directly into POJO
    try {
      PromptConfig cfg = jsonMapper.readValue(raw, PromptConfig.class);
      if (cfg.getRules() == null) {
        cfg.setRules(Map.of());
      }
      log.info("prompt.loaded location={} format=json", location);
      return cfg;
    } catch (IOException e) {
      throw new IllegalStateException("Prompt file is neither YAML nor JSON: " + location, e);
    }
  }

  private String readRaw(String location) throws IOException {
    if (location.startsWith(S3_PREFIX)) {
      String path = location.substring(S3_PREFIX.length());
      int slash = path.indexOf('/');
      if (slash <= 0) {
        throw new IllegalArgumentException("Invalid S3 prompt location: " + location);
      }
      ResponseBytes<?> bytes =
          s3Client.getObjectAsBytes(
              GetObjectRequest.builder()
                  .bucket(path.substring(0, slash))
                  .key(path.substring(slash + 1))
                  .build());
      return bytes.asString(StandardCharsets.UTF_8);
    }
    String path =
        location.startsWith(CLASSPATH_PREFIX)
            ? location.substring(CLASSPATH_PREFIX.length())
            : location;
    try (InputStream in = new ClassPathResource(path).getInputStream()) {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  /** Convert arbitrary YAML values to Map<String,String>. */
  private static Map<String, String> toStringMap(Object node) {
    if (node == null) return Map.of();
    if (node instanceof Map<?, ?> src) {
      Map<String, String> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : src.entrySet()) {
        String k = Objects.toString(e.getKey(), "");
        String v = (e.getValue() == null) ? null : e.getValue().toString();
        out.put(k, v);
      }
      return out;
    }
    return Map.of();
  }
}
