package quest.gekko.churnguard.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One row of the warehouse accounts feed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountRecord(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("launched_at") LocalDate launchedAt,
        @JsonProperty("archived_at") LocalDate archivedAt,
        @JsonProperty("earliest_unit_archived_at") LocalDate earliestUnitArchivedAt,
        @JsonProperty("owner") String owner
) {
}
