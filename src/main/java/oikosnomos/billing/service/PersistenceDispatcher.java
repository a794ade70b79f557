package oikosnomos.billing.service;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.config.BillingProperties;
import oikosnomos.billing.exception.TransientStoreException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs durable writes on the bounded persistence pool.
 *
 * A full queue drops the write with a warning and a counter, so callers never
 * block on the store. Transient failures are retried with bounded exponential
 * backoff; exhaustion is logged and counted. Once shutdown starts no retry is
 * scheduled and in-flight writes get shutdown-grace to finish.
 */
@Component
@Slf4j
public class PersistenceDispatcher {

    private final ThreadPoolTaskExecutor executor;
    private final BillingProperties.Persistence settings;
    private final MeterRegistry meterRegistry;

    private volatile boolean shuttingDown;

    public PersistenceDispatcher(@Qualifier("persistenceExecutor") ThreadPoolTaskExecutor executor,
                                 BillingProperties properties,
                                 MeterRegistry meterRegistry) {
        this.executor = executor;
        this.settings = properties.getPersistence();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Queues a write. Returns false when the write was dropped.
     */
    public boolean submit(String kind, String description, Runnable write) {
        if (shuttingDown) {
            log.warn("Shutdown in progress, not persisting {} {}", kind, description);
            return false;
        }
        try {
            executor.execute(() -> writeWithRetry(kind, description, write));
            return true;
        } catch (TaskRejectedException e) {
            meterRegistry.counter("billing.persistence.rejected", "kind", kind).increment();
            log.warn("Persistence queue full, dropping {} {}", kind, description);
            return false;
        }
    }

    void writeWithRetry(String kind, String description, Runnable write) {
        BackOffExecution backOff = newBackOff().start();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                write.run();
                if (attempt > 1) {
                    log.info("Persisted {} {} on attempt {}", kind, description, attempt);
                }
                return;
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    meterRegistry.counter("billing.persistence.exhausted", "kind", kind).increment();
                    log.error("Persisting {} {} failed and will not be retried: {}", kind, description, e.getMessage());
                    return;
                }
                long wait = backOff.nextBackOff();
                if (wait == BackOffExecution.STOP || shuttingDown) {
                    meterRegistry.counter("billing.persistence.exhausted", "kind", kind).increment();
                    log.warn("Giving up on {} {} after {} attempt(s): {}", kind, description, attempt, e.getMessage());
                    return;
                }
                log.debug("Attempt {} to persist {} {} failed, retrying in {} ms: {}",
                        attempt, kind, description, wait, e.getMessage());
                try {
                    Thread.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Abandoned {} {} during shutdown", kind, description);
                    return;
                }
            }
        }
    }

    static boolean isRetryable(RuntimeException e) {
        return e instanceof TransientStoreException
                || e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException;
    }

    private ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(
                settings.getInitialBackoff().toMillis(), settings.getBackoffMultiplier());
        backOff.setMaxInterval(settings.getMaxBackoff().toMillis());
        backOff.setMaxAttempts(settings.getMaxAttempts());
        return backOff;
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        Duration grace = settings.getShutdownGrace();
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = pool.shutdownNow();
                log.warn("Persistence did not finish within {}, abandoning {} queued write(s)", grace, abandoned.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List<Runnable> abandoned = pool.shutdownNow();
            log.warn("Interrupted while draining persistence, abandoning {} queued write(s)", abandoned.size());
        }
    }
}
