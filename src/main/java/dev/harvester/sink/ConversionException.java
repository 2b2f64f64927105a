package dev.harvester.sink;

/**
 * A member payload could not be turned into its serialized artifact. Member-level and non-fatal:
 * the crawl counts it and continues with the next member.
 */
public class ConversionException extends RuntimeException {

  private final String memberIdentity;

  public ConversionException(String memberIdentity, String message, Throwable cause) {
    super(message, cause);
    this.memberIdentity = memberIdentity;
  }

  public String getMemberIdentity() {
    return memberIdentity;
  }
}
