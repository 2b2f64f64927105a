package dev.harvester.extract;

import com.fasterxml.jackson.databind.JsonNode;
import dev.harvester.fetch.PageDocument;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Static helpers for document-level properties of event stream pages. */
public final class StreamDocuments {

  private static final String EVENT_STREAM = "EventStream";

  private static final Set<String> EVENT_STREAM_NAMES =
      Set.of(
          EVENT_STREAM,
          "ldes:" + EVENT_STREAM,
          "https://w3id.org/ldes#" + EVENT_STREAM,
          "http://w3id.org/ldes#" + EVENT_STREAM);

  private StreamDocuments() {
    // utility class
  }

  /**
   * Whether the document declares itself an event stream collection root. Every type field
   * ({@code @type}, {@code type}) is checked; each may hold a single name or an array. Accepted
   * names are {@code EventStream}, {@code ldes:EventStream} and the full LDES IRI.
   */
  public static boolean isEventStream(PageDocument document) {
    for (String key : SynonymKeys.TYPE.keys()) {
      JsonNode type = document.body().path(key);
      if (type.isArray()) {
        for (JsonNode element : type) {
          if (isEventStreamName(element)) {
            return true;
          }
        }
      } else if (isEventStreamName(type)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The JSON-LD context members of this page should use: the page's own {@code @context} when it
   * declares one, otherwise the inherited context.
   */
  public static @Nullable JsonNode contextOf(PageDocument document, @Nullable JsonNode inherited) {
    JsonNode own = SynonymKeys.CONTEXT.firstPresent(document.body());
    return own.isMissingNode() ? inherited : own;
  }

  private static boolean isEventStreamName(JsonNode value) {
    return value.isTextual() && EVENT_STREAM_NAMES.contains(value.asText());
  }
}
