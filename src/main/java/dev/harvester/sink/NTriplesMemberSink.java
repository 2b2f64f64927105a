package dev.harvester.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.harvester.config.HarvesterProperties;
import dev.harvester.extract.Member;
import dev.harvester.extract.Sha256;
import dev.harvester.extract.SynonymKeys;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.sparql.graph.GraphFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes each member as an N-Triples file named {@code <sha256(identity)>.nt} in the cache
 * directory.
 *
 * <p>The member is read as JSON-LD with Apache Jena. When the member wraps its object in
 * {@code @graph} (Activity Streams style), only the graph content is converted; the activity
 * envelope is dropped. The inherited page context is attached whenever the converted document
 * has no {@code @context} of its own.
 */
@Component
public class NTriplesMemberSink implements MemberSink {

  private static final Logger log = LoggerFactory.getLogger(NTriplesMemberSink.class);

  static final String EXTENSION = ".nt";

  private final Path cacheDir;
  private final ObjectMapper objectMapper;

  @Autowired
  public NTriplesMemberSink(HarvesterProperties properties, ObjectMapper objectMapper) {
    this(properties.getCacheDir(), objectMapper);
  }

  NTriplesMemberSink(Path cacheDir, ObjectMapper objectMapper) {
    this.cacheDir = cacheDir;
    this.objectMapper = objectMapper;
  }

  @Override
  public Path persist(Member member) {
    Graph graph = parse(member);

    Path target = cacheDir.resolve(artifactName(member.identity()));
    try (OutputStream out = Files.newOutputStream(target)) {
      RDFDataMgr.write(out, graph, Lang.NTRIPLES);
    } catch (IOException e) {
      throw new ConversionException(
          member.identity(), "Failed to write " + target + ": " + e.getMessage(), e);
    }
    log.debug("Saved member {} to {} ({} triples)", member.identity(), target.getFileName(), graph.size());
    return target;
  }

  /**
   * File name of the artifact for a member identity.
   *
   * @param identity member identity
   * @return hex SHA-256 of the identity plus the N-Triples extension
   */
  public static String artifactName(String identity) {
    return Sha256.hex(identity) + EXTENSION;
  }

  private Graph parse(Member member) {
    Graph graph = GraphFactory.createDefaultGraph();
    try {
      String jsonLd = objectMapper.writeValueAsString(toJsonLd(member));
      RDFParser.create().fromString(jsonLd).lang(Lang.JSONLD).parse(graph);
    } catch (JsonProcessingException | RuntimeException e) {
      throw new ConversionException(
          member.identity(), "Failed to parse member as JSON-LD: " + e.getMessage(), e);
    }
    return graph;
  }

  ObjectNode toJsonLd(Member member) {
    ObjectNode payload = member.payload();
    JsonNode context = member.context() != null
        ? member.context()
        : SynonymKeys.CONTEXT.firstPresent(payload);
    JsonNode graphData = SynonymKeys.GRAPH.firstPresent(payload);

    ObjectNode document;
    if (graphData.isObject()) {
      document = graphData.deepCopy();
    } else if (graphData.isArray()) {
      document = objectMapper.createObjectNode();
      document.set("@graph", graphData.deepCopy());
    } else {
      document = payload.deepCopy();
    }
    if (!document.has("@context") && context != null && !context.isMissingNode()) {
      document.set("@context", context.deepCopy());
    }
    return document;
  }
}
