package dev.harvester.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;

/**
 * Prioritized field-name synonyms for each concept read from an event stream document.
 *
 * <p>Publishers disagree on naming (with or without the {@code @} keyword marker, singular or
 * plural), so every lookup goes through one of these lists instead of a hard-coded field name.
 * Order matters: earlier keys win.
 */
public enum SynonymKeys {
  VIEW("view", "@view"),
  RELATION("relation", "@relation"),
  NODE("node", "@node"),
  IDENTIFIER("@id", "id"),
  MEMBER("member", "members", "@member", "@members"),
  MEMBER_IDENTITY("@id", "id", "object"),
  TYPE("@type", "type"),
  CONTEXT("@context"),
  GRAPH("@graph");

  private final List<String> keys;

  SynonymKeys(String... keys) {
    this.keys = List.of(keys);
  }

  public List<String> keys() {
    return keys;
  }

  /**
   * Returns the value of the first key that holds a non-empty value, or a {@link MissingNode}.
   * Null, empty strings, empty arrays and empty objects count as absent.
   */
  public JsonNode firstPresent(JsonNode node) {
    if (node == null || !node.isObject()) {
      return MissingNode.getInstance();
    }
    for (String key : keys) {
      JsonNode value = node.get(key);
      if (isPresent(value)) {
        return value;
      }
    }
    return MissingNode.getInstance();
  }

  /** Returns the first non-blank textual value among the keys, or {@code null}. */
  public String firstText(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    for (String key : keys) {
      JsonNode value = node.get(key);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  static boolean isPresent(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return false;
    }
    if (value.isContainerNode()) {
      return !value.isEmpty();
    }
    return !value.isTextual() || !value.asText().isEmpty();
  }
}
