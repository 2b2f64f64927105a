package dev.harvester.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable crawl progress: processed pages, processed member identities, the pending frontier and
 * running statistics.
 *
 * <p>Owned by a single {@link dev.harvester.crawl.CrawlEngine}. All methods are synchronized so
 * that a checkpoint taken from another thread (JVM shutdown) sees a consistent {@link
 * #snapshot(Instant)}. The frontier keeps insertion order and never holds a processed URL.
 */
public class CrawlState {

  private final Set<String> processedPages;
  private final Set<String> processedMembers;
  private final LinkedHashSet<String> pendingPages;
  private CrawlStatistics statistics;

  private CrawlState(
      Set<String> processedPages,
      Set<String> processedMembers,
      LinkedHashSet<String> pendingPages,
      CrawlStatistics statistics) {
    this.processedPages = processedPages;
    this.processedMembers = processedMembers;
    this.pendingPages = pendingPages;
    this.statistics = statistics;
  }

  /** Empty state for a cold start. */
  public static CrawlState fresh(Instant startTime) {
    return new CrawlState(
        new LinkedHashSet<>(),
        new LinkedHashSet<>(),
        new LinkedHashSet<>(),
        CrawlStatistics.startingAt(startTime));
  }

  /**
   * Rebuild state from a saved snapshot. Pending URLs that are already processed are dropped.
   *
   * @param snapshot the loaded snapshot
   * @param now      start time used when the snapshot carries no statistics
   */
  public static CrawlState fromSnapshot(StateSnapshot snapshot, Instant now) {
    Set<String> processed = new LinkedHashSet<>(snapshot.processedPages());
    LinkedHashSet<String> pending = new LinkedHashSet<>(snapshot.pendingPages());
    pending.removeAll(processed);
    CrawlStatistics stats = snapshot.stats();
    if (stats == null || stats.startTime() == null) {
      stats = CrawlStatistics.startingAt(now);
    }
    return new CrawlState(processed, new LinkedHashSet<>(snapshot.processedMembers()), pending, stats);
  }

  public synchronized boolean isPageProcessed(String url) {
    return processedPages.contains(url);
  }

  public synchronized boolean isPending(String url) {
    return pendingPages.contains(url);
  }

  public synchronized boolean isMemberProcessed(String identity) {
    return processedMembers.contains(identity);
  }

  /**
   * Add a URL to the frontier.
   *
   * @return true if the URL was added, false if it was already pending or processed
   */
  public synchronized boolean enqueue(String url) {
    if (processedPages.contains(url)) {
      return false;
    }
    return pendingPages.add(url);
  }

  /**
   * Move a page from the frontier to the processed set and count it.
   *
   * @return the updated processed page count
   */
  public synchronized long markPageProcessed(String url) {
    pendingPages.remove(url);
    if (processedPages.add(url)) {
      statistics = statistics.withPageProcessed();
    }
    return statistics.pagesProcessed();
  }

  public synchronized void recordMember(String identity) {
    if (processedMembers.add(identity)) {
      statistics = statistics.withMemberHarvested();
    }
  }

  public synchronized void recordError() {
    statistics = statistics.withError();
  }

  public synchronized void finish(Instant end, Duration elapsed) {
    statistics = statistics.finishedAt(end, elapsed);
  }

  public synchronized List<String> pendingPages() {
    return new ArrayList<>(pendingPages);
  }

  public synchronized int processedPageCount() {
    return processedPages.size();
  }

  public synchronized int processedMemberCount() {
    return processedMembers.size();
  }

  public synchronized CrawlStatistics statistics() {
    return statistics;
  }

  /** Consistent copy of the whole state, ready for serialization. */
  public synchronized StateSnapshot snapshot(Instant now) {
    return new StateSnapshot(
        new ArrayList<>(processedPages),
        new ArrayList<>(processedMembers),
        new ArrayList<>(pendingPages),
        statistics,
        now);
  }
}
