package dev.harvester.cli;

import dev.harvester.config.HarvesterProperties;
import dev.harvester.crawl.CrawlEngine;
import dev.harvester.crawl.HarvestException;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line adapter: {@code ldes-harvester <url> [--cache-dir=<dir>] [--no-resume]}.
 *
 * <p>Creates the cache directory, runs the harvest and maps the outcome to the process exit code:
 * 0 on success (even with counted page or member errors), 1 on bad usage, setup failure,
 * unreachable entry point or interruption. On JVM shutdown a running harvest is checkpointed.
 */
@Component
public class HarvestCommand implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(HarvestCommand.class);

  static final String NO_RESUME = "no-resume";
  static final String USAGE = "Usage: ldes-harvester <url> [--cache-dir=<dir>] [--no-resume]";

  private final CrawlEngine crawlEngine;
  private final HarvesterProperties properties;
  private final IntConsumer halt;

  private volatile int exitCode;

  @Autowired
  public HarvestCommand(CrawlEngine crawlEngine, HarvesterProperties properties) {
    this(crawlEngine, properties, status -> Runtime.getRuntime().halt(status));
  }

  HarvestCommand(CrawlEngine crawlEngine, HarvesterProperties properties, IntConsumer halt) {
    this.crawlEngine = crawlEngine;
    this.properties = properties;
    this.halt = halt;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() != 1) {
      log.error(USAGE);
      exitCode = 1;
      return;
    }

    Path cacheDir = properties.getCacheDir();
    try {
      Files.createDirectories(cacheDir);
    } catch (IOException e) {
      log.error("Cannot create cache directory {}: {}", cacheDir, e.getMessage());
      exitCode = 1;
      return;
    }

    boolean resume = !args.containsOption(NO_RESUME);
    try {
      crawlEngine.harvest(positional.get(0), resume);
      exitCode = 0;
    } catch (HarvestException e) {
      log.error("Fatal error: {}", e.getMessage());
      exitCode = 1;
    } catch (RuntimeException e) {
      log.error("Fatal error: {}", e.getMessage(), e);
      exitCode = 1;
    }
  }

  /**
   * Runs while the context closes. If a harvest is still in progress the JVM is shutting down
   * underneath it (SIGINT or SIGTERM): its state is saved and the process is halted with
   * status 1, as {@link #getExitCode()} is not consulted on that path.
   */
  @PreDestroy
  void onShutdown() {
    if (crawlEngine.checkpointIfRunning()) {
      log.info("Harvesting interrupted by user, state saved");
      exitCode = 1;
      halt.accept(exitCode);
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
