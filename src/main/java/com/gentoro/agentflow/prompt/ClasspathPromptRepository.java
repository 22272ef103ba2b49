package com.gentoro.agentflow.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.model.LlmClient;
import com.gentoro.agentflow.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (will resolve resources like "prompts/agent.yaml"). Templates are parsed once.
 */
public class ClasspathPromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  public PromptTemplate get(String name) {
    return cache.computeIfAbsent(name, this::load);
  }

  private PromptTemplate load(String name) {
    try {
      String id = (name.charAt(0) == '/' ? name.substring(1) : name);
      String resource = resolveExisting(id);
      if (resource == null) {
        throw new ConfigException("Prompt not found on classpath: " + name);
      }

      String yamlContent;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is == null) {
          throw new ConfigException("Prompt resource not found: " + resource);
        }
        yamlContent = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      }

      JsonNode arr = JacksonUtility.getYamlMapper().readTree(yamlContent).get("sections");
      if (arr == null || !arr.isArray()) {
        throw new ConfigException("Prompt YAML must contain a 'sections' array: " + id);
      }

      List<PromptTemplate.PromptSection> sections = new ArrayList<>();
      for (JsonNode n : arr) {
        String roleStr = n.path("role").asText("");
        LlmClient.Role role =
            switch (roleStr.toLowerCase(Locale.ROOT)) {
              case "user" -> LlmClient.Role.USER;
              case "assistant" -> LlmClient.Role.ASSISTANT;
              case "system" -> LlmClient.Role.SYSTEM;
              default -> throw new ConfigException(
                  "Unknown role '" + roleStr + "' in prompt: " + id);
            };
        String sectionId = n.path("id").asText("");
        if (sectionId.isBlank()) {
          throw new ConfigException("Missing section id in prompt: " + id);
        }
        String content = n.path("content").asText("");
        if (content.isBlank()) {
          throw new ConfigException(
              "Empty content for section '" + sectionId + "' in prompt: " + id);
        }
        sections.add(
            new PromptTemplate.PromptSection(
                role, sectionId, n.path("enabled").asBoolean(false), content));
      }
      return new PebblePromptTemplate(id, sections);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new ConfigException("Failed to read prompt file: " + name, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
