package quest.gekko.churnguard.dto;

/**
 * @param fetched  rows in the feed
 * @param upserted accounts written to the registry
 * @param skipped  rows outside the eligibility window
 * @param failed   rows whose upsert failed
 */
public record RegistrySyncResult(int fetched, int upserted, int skipped, int failed) {
}
