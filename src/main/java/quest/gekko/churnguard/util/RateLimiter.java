package quest.gekko.churnguard.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.exception.FactSourceException;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Bounds concurrent warehouse calls and retries failed ones with a fixed backoff.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retry;

    public RateLimiter(final ChurnGuardProperties.Warehouse warehouse) {
        this.sem = new Semaphore(Math.max(1, warehouse.maxConcurrentCalls()));
        this.retry = RetryTemplate.builder()
                .maxAttempts(Math.max(1, warehouse.maxAttempts()))
                .fixedBackoff(Math.max(1L, warehouse.backoff().toMillis()))
                .build();
    }

    public <T> T call(String what, Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FactSourceException("Interrupted while waiting to call " + what, e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (FactSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new FactSourceException("Warehouse call failed: " + what, e);
        } finally {
            sem.release();
        }
    }
}
