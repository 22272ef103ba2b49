package com.gentoro.agentflow.model;

import com.gentoro.agentflow.exception.LlmException;
import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionFunctionTool;
import com.openai.models.chat.completions.ChatCompletionMessageFunctionToolCall;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import com.openai.models.chat.completions.ChatCompletionTool;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * OpenAI implementation of {@link LlmClient} using the openai-java SDK (Chat Completions API).
 *
 * <p>Tool results are sent back as user messages labeled with the tool name, and earlier tool
 * requests as assistant text, so the conversation never depends on provider-side tool call ids.
 */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(OpenAiLlmClient.class);
  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(OpenAIClient openAIClient, Configuration configuration) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  public String modelId() {
    return configuration.getString("model", "gpt-4o-mini");
  }

  @Override
  protected LlmResponse runInference(List<Message> messages, List<ToolDefinition> tools) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder().model(modelId());
    if (configuration.containsKey("temperature")) {
      builder.temperature(configuration.getDouble("temperature"));
    }

    if (Message.contains(messages, Role.SYSTEM)) {
      builder.addSystemMessage(Message.findFirst(messages, Role.SYSTEM).content());
    }
    if (!tools.isEmpty()) {
      builder.tools(tools.stream().map(this::convertTool).toList());
      builder.parallelToolCalls(false);
    }

    for (Message message : Message.allExcept(messages, Role.SYSTEM)) {
      switch (message.role()) {
        case USER -> builder.addUserMessage(message.content());
        case ASSISTANT -> builder.addAssistantMessage(message.content());
        case TOOL ->
            builder.addUserMessage(
                "Result of tool `%s`:\n%s".formatted(message.toolName(), message.content()));
        default -> throw new LlmException("Unsupported message role: " + message.role());
      }
    }

    long start = System.currentTimeMillis();
    ChatCompletion chatCompletion = openAIClient.chat().completions().create(builder.build());
    if (chatCompletion.choices().isEmpty()) {
      throw new LlmException("OpenAI returned no choices");
    }
    ChatCompletion.Choice choice = chatCompletion.choices().get(0);
    log.debug(
        "OpenAI inference took {} ms, total tokens {}",
        System.currentTimeMillis() - start,
        chatCompletion.usage().map(u -> Long.toString(u.totalTokens())).orElse("n/a"));

    List<ChatCompletionMessageToolCall> toolCalls =
        choice.message().toolCalls().orElse(List.of());
    for (ChatCompletionMessageToolCall toolCall : toolCalls) {
      if (toolCall.function().isEmpty()) continue;
      ChatCompletionMessageFunctionToolCall call = toolCall.function().get();
      if (toolCalls.size() > 1) {
        log.debug("Model requested {} tool calls, using the first", toolCalls.size());
      }
      return LlmResponse.toolCall(
          new ToolCall(call.id(), call.function().name(), call.function().arguments()));
    }
    return LlmResponse.text(choice.message().content().map(String::trim).orElse(""));
  }

  private Map<String, Object> convertProperty(ToolProperty property) {
    Map<String, Object> result = new HashMap<>();
    result.put("type", asOpenAiType(property.getType()));
    result.put("description", property.getDescription());
    if (property.getType() == ToolProperty.Type.ARRAY) {
      result.put("items", convertProperty(property.getItems()));
    } else if (property.getType() == ToolProperty.Type.OBJECT) {
      Map<String, Object> props = new LinkedHashMap<>();
      property.getProperties().forEach(p -> props.put(p.getName(), convertProperty(p)));
      result.put("properties", props);
      result.put(
          "required",
          property.getProperties().stream()
              .filter(ToolProperty::isRequired)
              .map(ToolProperty::getName)
              .toList());
      result.put("additionalProperties", false);
    }
    return result;
  }

  private FunctionParameters convertSchema(ToolProperty property) {
    FunctionParameters.Builder paramsBuilder = FunctionParameters.builder();
    convertProperty(property)
        .forEach((key, value) -> paramsBuilder.putAdditionalProperty(key, JsonValue.from(value)));
    return paramsBuilder.build();
  }

  private String asOpenAiType(ToolProperty.Type type) {
    return switch (type) {
      case OBJECT -> "object";
      case NUMBER -> "number";
      case INTEGER -> "integer";
      case ARRAY -> "array";
      case BOOLEAN -> "boolean";
      case STRING -> "string";
    };
  }

  private ChatCompletionTool convertTool(ToolDefinition def) {
    FunctionDefinition function =
        FunctionDefinition.builder()
            .name(def.name())
            .description(def.description())
            .parameters(convertSchema(def.schema()))
            .build();
    return ChatCompletionTool.ofFunction(
            ChatCompletionFunctionTool.builder().function(function).build())
        .validate();
  }
}
