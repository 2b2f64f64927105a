package dev.harvester.extract;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Lowercase hex SHA-256 of UTF-8 text: content-derived member identities and artifact names. */
public final class Sha256 {

  private static final HexFormat HEX = HexFormat.of();

  private Sha256() {
    // utility class
  }

  public static String hex(String text) {
    return HEX.formatHex(newDigest().digest(text.getBytes(StandardCharsets.UTF_8)));
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("JVM provides no SHA-256 MessageDigest", e);
    }
  }
}
