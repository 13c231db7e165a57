package quest.gekko.churnguard.dto;

/**
 * @param classified accounts that got a level from the flag system
 * @param fallbacks  accounts whose classification failed and were defaulted to low
 * @param skipped    true when the pass did nothing (month already closed)
 */
public record ClassificationResult(String month, boolean historical, int classified, int fallbacks, boolean skipped) {

    public static ClassificationResult alreadyClosed(String month) {
        return new ClassificationResult(month, true, 0, 0, true);
    }
}
