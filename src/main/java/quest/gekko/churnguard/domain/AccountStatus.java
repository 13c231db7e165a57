package quest.gekko.churnguard.domain;

import java.util.Locale;

public enum AccountStatus {
    LAUNCHED,
    PAUSED,
    FROZEN,
    ARCHIVED;

    /**
     * Maps a status string from the accounts feed. The feed still emits the legacy ACTIVE value for launched accounts.
     */
    public static AccountStatus fromFeed(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing account status");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("ACTIVE")) return LAUNCHED;
        return AccountStatus.valueOf(normalized);
    }
}
