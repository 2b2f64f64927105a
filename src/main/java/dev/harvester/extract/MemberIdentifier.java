package dev.harvester.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * Computes the canonical identity of a member record.
 *
 * <p>The first usable field of {@link SynonymKeys#MEMBER_IDENTITY} wins: a non-blank string, or an
 * object whose {@code @id}/{@code id} is a non-blank string. Without one, the identity is the
 * SHA-256 of the member serialized with sorted keys and no whitespace, so identical content in any
 * key order maps to the same identity. Array order is significant.
 */
@Component
public class MemberIdentifier {

  private final ObjectMapper canonicalMapper;

  public MemberIdentifier(ObjectMapper objectMapper) {
    this.canonicalMapper =
        objectMapper
            .copy()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT);
  }

  public String identify(JsonNode member) {
    for (String key : SynonymKeys.MEMBER_IDENTITY.keys()) {
      JsonNode value = member.get(key);
      if (value == null) {
        continue;
      }
      if (value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
      if (value.isObject()) {
        String nested = SynonymKeys.IDENTIFIER.firstText(value);
        if (nested != null) {
          return nested;
        }
      }
    }
    return Sha256.hex(canonicalJson(member));
  }

  String canonicalJson(JsonNode member) {
    try {
      // Maps, unlike ObjectNodes, honour ORDER_MAP_ENTRIES_BY_KEYS at every nesting level.
      Object plain = canonicalMapper.convertValue(member, Object.class);
      return canonicalMapper.writeValueAsString(plain);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Member cannot be serialized canonically", e);
    }
  }
}
