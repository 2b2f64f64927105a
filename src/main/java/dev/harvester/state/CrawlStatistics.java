package dev.harvester.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable running statistics of a harvest, persisted with the crawl state so that counters
 * accumulate across resumed runs.
 *
 * <p>Each mutation produces a new record.
 *
 * @param startTime        when the harvest (first run) started
 * @param membersHarvested members written to the cache
 * @param pagesProcessed   pages fully processed
 * @param errors           page and member failures
 * @param totalDuration    duration of the last completed run in seconds
 * @param endTime          when the last run finished, or null while running
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlStatistics(
        @JsonProperty("start_time") @JsonDeserialize(using = LenientInstantDeserializer.class)
        @Nullable Instant startTime,
        @JsonProperty("members_harvested") long membersHarvested,
        @JsonProperty("pages_processed") long pagesProcessed,
        @JsonProperty("errors") long errors,
        @JsonProperty("total_duration") double totalDuration,
        @JsonProperty("end_time") @JsonDeserialize(using = LenientInstantDeserializer.class)
        @Nullable Instant endTime
) {

    public static CrawlStatistics startingAt(Instant startTime) {
        return new CrawlStatistics(startTime, 0, 0, 0, 0.0, null);
    }

    public CrawlStatistics withMemberHarvested() {
        return new CrawlStatistics(startTime, membersHarvested + 1, pagesProcessed, errors, totalDuration, endTime);
    }

    public CrawlStatistics withPageProcessed() {
        return new CrawlStatistics(startTime, membersHarvested, pagesProcessed + 1, errors, totalDuration, endTime);
    }

    public CrawlStatistics withError() {
        return new CrawlStatistics(startTime, membersHarvested, pagesProcessed, errors + 1, totalDuration, endTime);
    }

    public CrawlStatistics finishedAt(Instant end, Duration elapsed) {
        return new CrawlStatistics(
                startTime, membersHarvested, pagesProcessed, errors, elapsed.toMillis() / 1000.0, end);
    }
}
