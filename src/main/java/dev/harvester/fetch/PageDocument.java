package dev.harvester.fetch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A fetched and parsed event stream page.
 *
 * @param url  the URL the document was fetched from, used as the page identity
 * @param body the parsed JSON(-LD) object
 */
public record PageDocument(String url, ObjectNode body) {

    public PageDocument {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(body, "body");
    }
}
