package com.gentoro.agentflow.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A node of a tool's input schema. Immutable once built. */
public final class ToolProperty {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final ToolProperty items;
  private final List<ToolProperty> properties;

  public ToolProperty(
      String name,
      String description,
      boolean required,
      Type type,
      ToolProperty items,
      List<ToolProperty> properties) {
    this.name = name;
    this.description = description == null ? "" : description;
    this.required = required;
    this.type = Objects.requireNonNull(type, "type");
    this.items = items;
    this.properties = properties == null ? List.of() : List.copyOf(properties);
    if (type == Type.ARRAY && items == null) {
      throw new IllegalArgumentException("Array property '" + name + "' needs an items schema");
    }
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return isRequired() == that.isRequired()
        && Objects.equals(getName(), that.getName())
        && Objects.equals(getDescription(), that.getDescription())
        && getType() == that.getType()
        && Objects.equals(getItems(), that.getItems())
        && Objects.equals(getProperties(), that.getProperties());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getDescription(), isRequired(), getType());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolProperty items;
    private List<ToolProperty> properties;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder property(ToolProperty property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(name, description, required, type, items, properties);
    }
  }
}
