package dev.harvester.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.harvester.config.HarvesterProperties;
import dev.harvester.extract.Member;
import dev.harvester.extract.MemberExtractor;
import dev.harvester.extract.MemberIdentifier;
import dev.harvester.extract.RelationExtractor;
import dev.harvester.extract.StreamDocuments;
import dev.harvester.fetch.DocumentFetchException;
import dev.harvester.fetch.DocumentFetcher;
import dev.harvester.fetch.PageDocument;
import dev.harvester.sink.ConversionException;
import dev.harvester.sink.MemberSink;
import dev.harvester.state.CrawlState;
import dev.harvester.state.CrawlStatistics;
import dev.harvester.state.StatePersistException;
import dev.harvester.state.StateStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Service;

/**
 * Harvest orchestrator: walks the relation graph of an event stream, persists every member once
 * and checkpoints progress so an interrupted harvest resumes where it stopped.
 *
 * <p>Traversal is depth-first over an explicit worklist. A URL enters the frontier (the pending
 * set of {@link CrawlState}) when it is discovered and leaves it only once its members are
 * persisted, so a checkpoint always covers every page still owed. Page failures are counted and
 * leave the page pending for the next run; member conversion failures are counted and skipped.
 *
 * <p>Pages already processed in an earlier run are fetched again when reached, only to pick up
 * relations appended since (a live stream grows at its tail). Their members are not re-read, and
 * relations that disappeared from such a page are never removed from the frontier.
 */
@Service
public class CrawlEngine {

  private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

  private static final String RULE = "=".repeat(60);

  private final DocumentFetcher documentFetcher;
  private final RelationExtractor relationExtractor;
  private final MemberExtractor memberExtractor;
  private final MemberIdentifier memberIdentifier;
  private final MemberSink memberSink;
  private final StateStore stateStore;
  private final Clock clock;
  private final int checkpointInterval;
  private final Path cacheDir;

  private volatile @Nullable CrawlState activeState;

  public CrawlEngine(
      DocumentFetcher documentFetcher,
      RelationExtractor relationExtractor,
      MemberExtractor memberExtractor,
      MemberIdentifier memberIdentifier,
      MemberSink memberSink,
      StateStore stateStore,
      HarvesterProperties properties,
      Clock clock) {
    this.documentFetcher = documentFetcher;
    this.relationExtractor = relationExtractor;
    this.memberExtractor = memberExtractor;
    this.memberIdentifier = memberIdentifier;
    this.memberSink = memberSink;
    this.stateStore = stateStore;
    this.clock = clock;
    this.checkpointInterval = properties.getCheckpointInterval();
    this.cacheDir = properties.getCacheDir();
  }

  /**
   * Harvest an event stream. With {@code resume} set, saved state is loaded first and its pending
   * pages are drained before the entry point is consulted; if that empties the frontier the run
   * ends there.
   *
   * <p>State is checkpointed every {@code checkpoint-interval} processed pages and always when
   * the run ends, whether it succeeds or fails.
   *
   * @param entryUrl URL of the collection root or of a single page
   * @param resume   whether to continue from the saved state
   * @return statistics of the run
   * @throws HarvestException if the entry point cannot be fetched or the run is interrupted
   */
  public HarvestSummary harvest(String entryUrl, boolean resume) {
    Instant started = clock.instant();
    CrawlState state = resume ? loadState(started) : CrawlState.fresh(started);
    CrawlStatistics before = state.statistics();
    activeState = state;

    log.info("Starting LDES harvest from: {}", entryUrl);
    HarvestSummary summary;
    try {
      crawl(state, entryUrl);
    } finally {
      activeState = null;
      summary = finish(state, started, before);
    }
    return summary;
  }

  /**
   * Save the state of a harvest that is still running, for use on JVM shutdown.
   *
   * @return true if a running harvest was checkpointed
   */
  public boolean checkpointIfRunning() {
    CrawlState state = activeState;
    if (state == null) {
      return false;
    }
    checkpoint(state);
    return true;
  }

  private CrawlState loadState(Instant now) {
    return stateStore
        .load()
        .map(
            snapshot -> {
              CrawlState state = CrawlState.fromSnapshot(snapshot, now);
              log.info(
                  "Resumed from previous state: {} members, {} pages, {} pending",
                  state.processedMemberCount(),
                  state.processedPageCount(),
                  state.pendingPages().size());
              return state;
            })
        .orElseGet(() -> CrawlState.fresh(now));
  }

  private void crawl(CrawlState state, String entryUrl) {
    List<String> pending = state.pendingPages();
    if (!pending.isEmpty()) {
      log.info("Resuming with {} pending pages", pending.size());
      for (String url : pending) {
        if (!state.isPageProcessed(url)) {
          log.info("Resuming from pending page: {}", url);
          traverse(state, new WorkItem(url, null, null));
        }
      }
      if (state.pendingPages().isEmpty()) {
        log.info("All pending pages processed, harvest complete");
        return;
      }
    }

    PageDocument entry;
    try {
      entry = documentFetcher.fetch(entryUrl);
    } catch (DocumentFetchException e) {
      state.recordError();
      throw new HarvestException("Entry point could not be fetched: " + e.getMessage(), e);
    } catch (BackOffInterruptedException e) {
      throw interrupted(e);
    }
    JsonNode context = StreamDocuments.contextOf(entry, null);

    if (StreamDocuments.isEventStream(entry)) {
      log.info("Detected EventStream collection entry point");
      List<String> initialUrls = relationExtractor.extractRelations(entry);
      log.info("Found {} initial pages to process", initialUrls.size());
      for (String url : initialUrls) {
        traverse(state, new WorkItem(url, context, null));
      }
    } else {
      log.info("Processing as direct LDES page");
      traverse(state, new WorkItem(entryUrl, context, entry));
    }
  }

  private void traverse(CrawlState state, WorkItem seed) {
    Deque<WorkItem> worklist = new ArrayDeque<>();
    worklist.push(seed);
    while (!worklist.isEmpty()) {
      if (Thread.currentThread().isInterrupted()) {
        throw interrupted(null);
      }
      WorkItem item = worklist.pop();
      List<WorkItem> next =
          state.isPageProcessed(item.url()) ? revisitPage(state, item) : processPage(state, item);
      // reversed so that relations are visited in document order
      for (int i = next.size() - 1; i >= 0; i--) {
        worklist.push(next.get(i));
      }
    }
  }

  private List<WorkItem> processPage(CrawlState state, WorkItem item) {
    String url = item.url();
    try {
      state.enqueue(url);
      PageDocument document = item.prefetched() != null ? item.prefetched() : documentFetcher.fetch(url);
      JsonNode pageContext = StreamDocuments.contextOf(document, item.context());

      List<ObjectNode> members = memberExtractor.extractMembers(document);
      log.info("Found {} members on page: {}", members.size(), url);
      for (ObjectNode payload : members) {
        persistMember(state, payload, pageContext);
      }

      long pagesProcessed = state.markPageProcessed(url);
      List<WorkItem> next = discover(state, document, pageContext);
      // after discovery, so the saved frontier already holds this page's successors
      if (pagesProcessed % checkpointInterval == 0) {
        checkpoint(state);
      }
      return next;
    } catch (BackOffInterruptedException e) {
      throw interrupted(e);
    } catch (RuntimeException e) {
      log.error("Failed to process page {}: {}", url, e.getMessage());
      state.recordError();
      return List.of();
    }
  }

  private List<WorkItem> revisitPage(CrawlState state, WorkItem item) {
    log.debug("Already processed page: {}, checking for unprocessed next pages", item.url());
    try {
      PageDocument document =
          item.prefetched() != null ? item.prefetched() : documentFetcher.fetch(item.url());
      return discover(state, document, StreamDocuments.contextOf(document, item.context()));
    } catch (BackOffInterruptedException e) {
      throw interrupted(e);
    } catch (RuntimeException e) {
      log.error("Failed to extract next pages from {}: {}", item.url(), e.getMessage());
      state.recordError();
      return List.of();
    }
  }

  private void persistMember(CrawlState state, ObjectNode payload, @Nullable JsonNode context) {
    String identity = memberIdentifier.identify(payload);
    if (state.isMemberProcessed(identity)) {
      log.debug("Skipping already harvested member {}", identity);
      return;
    }
    try {
      memberSink.persist(new Member(identity, payload, context));
      state.recordMember(identity);
    } catch (ConversionException e) {
      log.error("Failed to save member {}: {}", identity, e.getMessage());
      state.recordError();
    }
  }

  private List<WorkItem> discover(CrawlState state, PageDocument document, @Nullable JsonNode context) {
    List<WorkItem> next = new ArrayList<>();
    for (String url : relationExtractor.extractRelations(document)) {
      if (state.enqueue(url)) {
        next.add(new WorkItem(url, context, null));
      }
    }
    return next;
  }

  private boolean checkpoint(CrawlState state) {
    try {
      stateStore.save(state.snapshot(clock.instant()));
      return true;
    } catch (StatePersistException e) {
      log.error(e.getMessage());
      return false;
    }
  }

  private HarvestSummary finish(CrawlState state, Instant started, CrawlStatistics before) {
    Instant ended = clock.instant();
    Duration elapsed = Duration.between(started, ended);
    state.finish(ended, elapsed);
    checkpoint(state);

    CrawlStatistics stats = state.statistics();
    HarvestSummary summary =
        new HarvestSummary(
            stats,
            stats.pagesProcessed() - before.pagesProcessed(),
            stats.membersHarvested() - before.membersHarvested(),
            state.pendingPages().size(),
            elapsed);
    logSummary(summary);
    return summary;
  }

  private void logSummary(HarvestSummary summary) {
    CrawlStatistics stats = summary.statistics();
    log.info(RULE);
    log.info(summary.complete() ? "HARVESTING COMPLETE" : "HARVESTING STOPPED WITH PENDING PAGES");
    log.info(RULE);
    log.info("Members harvested: {} ({} this run)", stats.membersHarvested(), summary.membersThisRun());
    log.info("Pages processed: {} ({} this run)", stats.pagesProcessed(), summary.pagesThisRun());
    log.info("Errors encountered: {}", stats.errors());
    log.info("Pending pages: {}", summary.pendingPages());
    log.info("Duration: {} seconds", String.format(Locale.US, "%.2f", summary.elapsed().toMillis() / 1000.0));
    log.info("Cache directory: {}", cacheDir.toAbsolutePath());
    log.info(RULE);
  }

  private static HarvestException interrupted(@Nullable Throwable cause) {
    Thread.currentThread().interrupt();
    return new HarvestException("Harvest interrupted", cause);
  }

  /** A page to visit, the context inherited from the page that linked it, and its document if already fetched. */
  private record WorkItem(String url, @Nullable JsonNode context, @Nullable PageDocument prefetched) {}
}
