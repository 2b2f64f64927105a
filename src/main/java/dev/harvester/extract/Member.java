package dev.harvester.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One event record extracted from a page.
 *
 * @param identity canonical identity computed by {@link MemberIdentifier}
 * @param payload  the raw member object as published
 * @param context  JSON-LD context inherited from the enclosing page, if any
 */
public record Member(String identity, ObjectNode payload, @Nullable JsonNode context) {

  public Member {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(payload, "payload");
  }
}
