package dev.harvester.crawl;

/** Fatal harvest failure: the entry point is unreachable or the run was interrupted. */
public class HarvestException extends RuntimeException {

  public HarvestException(String message, Throwable cause) {
    super(message, cause);
  }
}
