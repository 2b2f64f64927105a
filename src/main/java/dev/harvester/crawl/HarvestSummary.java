package dev.harvester.crawl;

import dev.harvester.state.CrawlStatistics;
import java.time.Duration;

/**
 * Outcome of one harvest run.
 *
 * @param statistics     cumulative statistics, including earlier resumed runs
 * @param pagesThisRun   pages processed by this run
 * @param membersThisRun members persisted by this run
 * @param pendingPages   pages still in the frontier at the end of the run
 * @param elapsed        wall-clock duration of this run
 */
public record HarvestSummary(
        CrawlStatistics statistics,
        long pagesThisRun,
        long membersThisRun,
        int pendingPages,
        Duration elapsed
) {

    /** Whether every discovered page has been processed. */
    public boolean complete() {
        return pendingPages == 0;
    }
}
