package dev.harvester.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.harvester.config.HarvesterProperties;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Loads and saves the crawl snapshot as human-readable JSON in {@code <cache-dir>/state.json}.
 *
 * <p>Saving fully replaces the previous file: the snapshot is written to a sibling temporary file
 * and moved over the old one. Loading never throws; a missing or unreadable file means "start
 * fresh".
 */
@Component
public class StateStore {

  private static final Logger log = LoggerFactory.getLogger(StateStore.class);

  static final String STATE_FILE = "state.json";

  private final Path stateFile;
  private final ObjectMapper mapper;

  @Autowired
  public StateStore(HarvesterProperties properties, ObjectMapper objectMapper) {
    this(properties.getCacheDir().resolve(STATE_FILE), objectMapper);
  }

  StateStore(Path stateFile, ObjectMapper objectMapper) {
    this.stateFile = stateFile;
    this.mapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Read the saved snapshot.
   *
   * @return the snapshot, or empty if there is no state file or it cannot be parsed
   */
  public Optional<StateSnapshot> load() {
    if (!Files.exists(stateFile)) {
      return Optional.empty();
    }
    try {
      StateSnapshot snapshot = mapper.readValue(stateFile.toFile(), StateSnapshot.class);
      return Optional.ofNullable(snapshot);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to load state from {}: {}", stateFile, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Overwrite the state file with the given snapshot.
   *
   * @throws StatePersistException if the file cannot be written
   */
  public void save(StateSnapshot snapshot) {
    Path temp = stateFile.resolveSibling(STATE_FILE + ".tmp");
    try {
      Files.createDirectories(stateFile.toAbsolutePath().getParent());
      mapper.writeValue(temp.toFile(), snapshot);
      try {
        Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException | RuntimeException e) {
      throw new StatePersistException(stateFile, e);
    }
  }

  public Path getStateFile() {
    return stateFile;
  }
}
