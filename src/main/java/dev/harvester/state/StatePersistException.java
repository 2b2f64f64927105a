package dev.harvester.state;

import java.nio.file.Path;

/** The state file could not be written. The crawl keeps running on in-memory state. */
public class StatePersistException extends RuntimeException {

  public StatePersistException(Path stateFile, Throwable cause) {
    super("Failed to save state to " + stateFile + ": " + cause.getMessage(), cause);
  }
}
