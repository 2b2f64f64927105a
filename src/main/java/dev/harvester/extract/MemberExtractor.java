package dev.harvester.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.harvester.fetch.PageDocument;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects the raw member records of a page from every container field listed in {@link
 * SynonymKeys#MEMBER}, in key order then source order. No deduplication happens here.
 */
@Component
public class MemberExtractor {

  private static final Logger log = LoggerFactory.getLogger(MemberExtractor.class);

  public List<ObjectNode> extractMembers(PageDocument document) {
    List<ObjectNode> members = new ArrayList<>();
    for (String key : SynonymKeys.MEMBER.keys()) {
      JsonNode value = document.body().get(key);
      if (value == null) {
        continue;
      }
      if (value.isArray()) {
        for (JsonNode element : value) {
          addIfRecord(element, members, document);
        }
      } else {
        addIfRecord(value, members, document);
      }
    }
    return members;
  }

  private static void addIfRecord(JsonNode value, List<ObjectNode> members, PageDocument document) {
    if (value instanceof ObjectNode record) {
      members.add(record);
    } else if (!value.isNull()) {
      log.debug("Ignoring non-object member value on {}: {}", document.url(), value.getNodeType());
    }
  }
}
