package com.gentoro.agentflow.prompt;

import com.gentoro.agentflow.exception.StateException;
import com.gentoro.agentflow.model.LlmClient;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble-based implementation of an immutable PromptTemplate definition. Rendering state is
 * isolated in PromptSession instances.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    this.compiled =
        this.sections.stream()
            .map(s -> new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())))
            .toList();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    return new Session();
  }

  private class Session implements PromptSession {
    private final Map<String, Map<String, Object>> enabled = new LinkedHashMap<>();

    Session() {
      for (PromptSection s : sections) {
        if (s.enabledByDefault()) {
          enable(s.id(), Map.of());
        }
      }
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      if (sections.stream().noneMatch(s -> s.id().equals(sectionId))) {
        throw new StateException(
            "Unknown section '%s' in prompt template '%s'".formatted(sectionId, id));
      }
      enabled.put(sectionId, vars != null ? new HashMap<>(vars) : new HashMap<>());
      return this;
    }

    @Override
    public PromptSession clear() {
      enabled.clear();
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      List<LlmClient.Message> out = new ArrayList<>();
      for (CompiledSection cs : compiled) {
        PromptSection s = cs.section();
        if (!enabled.containsKey(s.id())) continue;
        try {
          Writer writer = new StringWriter();
          cs.template().evaluate(writer, enabled.get(s.id()));
          out.add(new LlmClient.Message(s.role(), writer.toString().strip(), null, null));
        } catch (Exception e) {
          throw new StateException(
              "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
        }
      }
      return out;
    }

    @Override
    public String renderText() {
      return String.join(
          "\n\n", renderMessages().stream().map(LlmClient.Message::content).toList());
    }
  }
}
