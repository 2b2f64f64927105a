package dev.harvester.fetch;

/** The response body of a page was not a JSON object. Never retried. */
public class DocumentParseException extends DocumentFetchException {

  public DocumentParseException(String url, String reason, Throwable cause) {
    super(url, "Malformed document at " + url + ": " + reason, cause);
  }
}
