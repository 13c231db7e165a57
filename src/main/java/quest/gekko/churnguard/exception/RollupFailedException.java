package quest.gekko.churnguard.exception;

import java.time.YearMonth;

public class RollupFailedException extends RuntimeException {
    private final YearMonth month;

    public RollupFailedException(YearMonth month, Throwable cause) {
        super("Monthly rollup failed for " + month + ": " + cause.getMessage(), cause);
        this.month = month;
    }

    public YearMonth getMonth() {
        return month;
    }
}
