package quest.gekko.churnguard.dto;

public record RollupResult(String month, String monthLabel, int deleted, int accountsProcessed) {
}
