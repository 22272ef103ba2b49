package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.model.ToolProperty;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** Checks tool arguments against a {@link ToolProperty} schema. */
public final class ToolArgumentValidator {
  private ToolArgumentValidator() {}

  /** Returns the problems found; an empty list means the arguments are valid. */
  public static List<String> validate(ToolProperty schema, JsonNode arguments) {
    List<String> problems = new ArrayList<>();
    check(schema, arguments, "$", problems);
    return problems;
  }

  private static void check(ToolProperty schema, JsonNode value, String path, List<String> out) {
    if (value == null || value.isMissingNode() || value.isNull()) {
      out.add(path + ": value is missing");
      return;
    }
    switch (schema.getType()) {
      case STRING -> {
        if (!value.isTextual()) out.add(path + ": expected string");
      }
      case BOOLEAN -> {
        if (!value.isBoolean()) out.add(path + ": expected boolean");
      }
      case INTEGER -> {
        if (!value.isIntegralNumber()) out.add(path + ": expected integer");
      }
      case NUMBER -> {
        if (!value.isNumber()) out.add(path + ": expected number");
      }
      case ARRAY -> {
        if (!value.isArray()) {
          out.add(path + ": expected array");
          return;
        }
        for (int i = 0; i < value.size(); i++) {
          check(schema.getItems(), value.get(i), path + "[" + i + "]", out);
        }
      }
      case OBJECT -> {
        if (!value.isObject()) {
          out.add(path + ": expected object");
          return;
        }
        Set<String> declared = new HashSet<>();
        for (ToolProperty p : schema.getProperties()) {
          declared.add(p.getName());
          JsonNode child = value.get(p.getName());
          if (child == null || child.isNull()) {
            if (p.isRequired()) out.add(path + "." + p.getName() + ": required");
            continue;
          }
          check(p, child, path + "." + p.getName(), out);
        }
        if (!schema.getProperties().isEmpty()) {
          Iterator<String> names = value.fieldNames();
          while (names.hasNext()) {
            String n = names.next();
            if (!declared.contains(n)) out.add(path + "." + n + ": unknown argument");
          }
        }
      }
    }
  }
}
