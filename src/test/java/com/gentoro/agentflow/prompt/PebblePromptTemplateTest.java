package com.gentoro.agentflow.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.exception.StateException;
import com.gentoro.agentflow.model.LlmClient;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PebblePromptTemplateTest {

  private final PromptTemplate agentPrompt = new ClasspathPromptRepository("prompts").get("agent");

  @Test
  void agentPromptSections() {
    assertEquals(
        List.of("system", "reflection", "json-correction"),
        agentPrompt.sections().stream().map(PromptTemplate.PromptSection::id).toList());
  }

  @Test
  void rendersEnabledSectionsInDefinitionOrder() {
    List<LlmClient.Message> messages =
        agentPrompt
            .newSession()
            .enable("json-correction", Map.of("problem", "unexpected end of input"))
            .enable(
                "system",
                Map.of(
                    "name", "analyst",
                    "role", "Data analyst",
                    "goal", "Explain the numbers",
                    "backstory", "",
                    "tools", List.of("sql_query", "csv_export"),
                    "json", true))
            .renderMessages();

    assertEquals(2, messages.size());
    assertEquals(LlmClient.Role.SYSTEM, messages.get(0).role());
    String system = messages.get(0).content();
    assertTrue(system.startsWith("You are analyst, Data analyst."), system);
    assertTrue(system.contains("sql_query, csv_export"), system);
    assertTrue(system.contains("single valid JSON document"), system);
    assertFalse(system.contains("Background:"), system);
    assertEquals(LlmClient.Role.USER, messages.get(1).role());
    assertTrue(messages.get(1).content().contains("(unexpected end of input)"));
  }

  @Test
  void clearDisablesEverything() {
    PromptTemplate.PromptSession session =
        agentPrompt.newSession().enable("reflection", Map.of("draft", "42", "json", false));

    assertTrue(session.renderText().contains("Draft answer:\n42"));
    assertEquals("", session.clear().renderText());
  }

  @Test
  void missingVariableFailsToRender() {
    PromptTemplate.PromptSession session = agentPrompt.newSession().enable("reflection", Map.of());

    assertThrows(StateException.class, session::renderMessages);
  }

  @Test
  void unknownSection() {
    assertThrows(
        StateException.class, () -> agentPrompt.newSession().enable("greeting", Map.of()));
  }

  @Test
  void sectionsEnabledByDefault() {
    PromptTemplate template =
        new PebblePromptTemplate(
            "inline",
            List.of(
                new PromptTemplate.PromptSection(LlmClient.Role.SYSTEM, "a", true, "Always on"),
                new PromptTemplate.PromptSection(LlmClient.Role.USER, "b", false, "Hi {{ who }}")));

    assertEquals("Always on", template.newSession().renderText());
    assertEquals(
        "Always on\n\nHi there",
        template.newSession().enable("b", Map.of("who", "there")).renderText());
  }

  @Test
  void missingPromptResource() {
    assertThrows(
        ConfigException.class, () -> new ClasspathPromptRepository("prompts").get("missing"));
  }
}
