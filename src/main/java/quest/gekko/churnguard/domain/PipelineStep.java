package quest.gekko.churnguard.domain;

public enum PipelineStep {
    ACCOUNTS,
    DAILY_EXTRACT,
    MONTHLY_ROLLUP,
    TRENDING_RISK,
    HISTORICAL_RISK
}
