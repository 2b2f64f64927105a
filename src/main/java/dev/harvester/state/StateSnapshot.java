package dev.harvester.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Serialized form of the crawl state, written to {@code state.json}.
 *
 * @param processedPages   URLs of fully processed pages
 * @param processedMembers identities of persisted members
 * @param pendingPages     frontier in insertion order
 * @param stats            running statistics
 * @param lastUpdated      when this snapshot was taken
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StateSnapshot(
        @JsonProperty("processed_pages") List<String> processedPages,
        @JsonProperty("processed_members") List<String> processedMembers,
        @JsonProperty("pending_pages") List<String> pendingPages,
        @JsonProperty("stats") @Nullable CrawlStatistics stats,
        @JsonProperty("last_updated") @JsonDeserialize(using = LenientInstantDeserializer.class)
        @Nullable Instant lastUpdated
) {

    public StateSnapshot {
        processedPages = processedPages == null ? List.of() : List.copyOf(processedPages);
        processedMembers = processedMembers == null ? List.of() : List.copyOf(processedMembers);
        pendingPages = pendingPages == null ? List.of() : List.copyOf(pendingPages);
    }
}
