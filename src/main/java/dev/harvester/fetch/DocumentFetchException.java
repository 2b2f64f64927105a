package dev.harvester.fetch;

/**
 * Raised when a page could not be retrieved after all retry attempts.
 *
 * <p>Page-level failure: the crawl counts it as an error and leaves the page pending so that a
 * later run retries it.
 */
public class DocumentFetchException extends RuntimeException {

  private final String url;

  public DocumentFetchException(String url, Throwable cause) {
    this(url, "Failed to fetch " + url + ": " + cause.getMessage(), cause);
  }

  protected DocumentFetchException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
