package dev.harvester.extract;

import com.fasterxml.jackson.databind.JsonNode;
import dev.harvester.fetch.PageDocument;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the next-page URLs referenced by an event stream page.
 *
 * <p>Relations are read from every view ({@code view}, single object or list) and from the
 * document root. Each relation's {@code node} is either a URL string or an object carrying
 * {@code @id}/{@code id}. Results keep document order and are not deduplicated; the crawl
 * frontier does that. Relative URLs are resolved against the page URL.
 */
@Component
public class RelationExtractor {

  private static final Logger log = LoggerFactory.getLogger(RelationExtractor.class);

  /**
   * Extract relation targets from a page. Never fails: absent or oddly shaped fields yield an
   * empty list.
   *
   * @param document the fetched page
   * @return next-page URLs in document order, possibly with duplicates
   */
  public List<String> extractRelations(PageDocument document) {
    List<String> urls = new ArrayList<>();

    JsonNode view = SynonymKeys.VIEW.firstPresent(document.body());
    for (JsonNode v : asList(view)) {
      collectNodeUrls(SynonymKeys.RELATION.firstPresent(v), urls);
    }

    collectNodeUrls(SynonymKeys.RELATION.firstPresent(document.body()), urls);

    return urls.stream().map(url -> resolve(document.url(), url)).toList();
  }

  private void collectNodeUrls(JsonNode relation, List<String> urls) {
    if (relation.isArray()) {
      for (JsonNode element : relation) {
        collectNodeUrls(element, urls);
      }
      return;
    }
    JsonNode node = SynonymKeys.NODE.firstPresent(relation);
    if (node.isTextual()) {
      urls.add(node.asText());
    } else if (node.isObject()) {
      String id = SynonymKeys.IDENTIFIER.firstText(node);
      if (id != null) {
        urls.add(id);
      }
    }
  }

  private static List<JsonNode> asList(JsonNode value) {
    if (value.isArray()) {
      List<JsonNode> elements = new ArrayList<>(value.size());
      value.forEach(elements::add);
      return elements;
    }
    return value.isObject() ? List.of(value) : List.of();
  }

  private static String resolve(String base, String href) {
    try {
      return URI.create(base).resolve(href).toString();
    } catch (IllegalArgumentException e) {
      log.debug("Keeping unresolvable relation {} relative to {}: {}", href, base, e.getMessage());
      return href;
    }
  }
}
