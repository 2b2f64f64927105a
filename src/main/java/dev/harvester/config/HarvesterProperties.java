package dev.harvester.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the harvester.
 *
 * <p>Properties are bound from {@code harvester.*} in application.yml. The cache directory
 * defaults to the {@code --cache-dir} command line option, falling back to {@code ./cache}.
 *
 * <ul>
 *   <li>{@code cache-dir} - directory holding member artifacts, {@code state.json} and the log
 *   <li>{@code checkpoint-interval} - number of processed pages between state checkpoints
 *       (default 10)
 *   <li>{@code http.*} - connect and read timeouts of a single page fetch
 * </ul>
 *
 * <p>Retry settings ({@code harvester.retry.*}) are read directly by the {@code @Retryable}
 * expressions on {@link dev.harvester.fetch.DocumentFetcher}.
 */
@Configuration
@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {

  private Path cacheDir = Path.of("./cache");
  private int checkpointInterval = 10;
  private final Http http = new Http();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (checkpointInterval < 1) {
      throw new IllegalStateException(
          "harvester.checkpoint-interval must be >= 1, got: " + checkpointInterval);
    }
    if (http.connectTimeoutMs < 1 || http.readTimeoutMs < 1) {
      throw new IllegalStateException("harvester.http timeouts must be positive");
    }
  }

  public Path getCacheDir() {
    return cacheDir;
  }

  public void setCacheDir(Path cacheDir) {
    this.cacheDir = cacheDir;
  }

  public int getCheckpointInterval() {
    return checkpointInterval;
  }

  public void setCheckpointInterval(int checkpointInterval) {
    this.checkpointInterval = checkpointInterval;
  }

  public Http getHttp() {
    return http;
  }

  public static class Http {

    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 30_000;

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
      return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = readTimeoutMs;
    }
  }
}
