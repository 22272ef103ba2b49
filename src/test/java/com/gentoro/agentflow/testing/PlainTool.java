package com.gentoro.agentflow.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.model.ToolProperty;
import com.gentoro.agentflow.tool.Tool;
import com.gentoro.agentflow.tool.ToolKind;
import com.gentoro.agentflow.tool.ToolResult;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Implements {@link Tool} directly, without the argument checks of the base class. Reads the
 * required {@code text} argument unguarded, and throws when built with {@code throwing}.
 */
public class PlainTool implements Tool {
  private final String name;
  private final boolean throwing;
  private final AtomicInteger invocations = new AtomicInteger();

  public PlainTool(String name, boolean throwing) {
    this.name = name;
    this.throwing = throwing;
  }

  public int invocations() {
    return invocations.get();
  }

  @Override
  public ToolKind kind() {
    return ToolKind.CUSTOM;
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name(name)
        .description("Upper-case the text")
        .schema(
            ToolProperty.builder()
                .name("arguments")
                .type(ToolProperty.Type.OBJECT)
                .property(
                    ToolProperty.builder()
                        .name("text")
                        .type(ToolProperty.Type.STRING)
                        .required(true)
                        .build())
                .build())
        .build();
  }

  @Override
  public ToolResult invoke(JsonNode arguments) {
    invocations.incrementAndGet();
    if (throwing) {
      throw new IllegalStateException("backend unavailable");
    }
    String text = arguments.get("text").asText();
    return ToolResult.ok(
        JsonNodeFactory.instance.objectNode().put("upper", text.toUpperCase(Locale.ROOT)));
  }
}
