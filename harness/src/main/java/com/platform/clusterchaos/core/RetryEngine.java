package com.platform.clusterchaos.core;

import com.platform.clusterchaos.error.HarnessInterruptedException;
import com.platform.clusterchaos.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry loop with exponential backoff.
 * Probes report a tagged {@link PollOutcome}; this class only decides when to try again.
 */
@Slf4j
@Component
public class RetryEngine {

    private final Sleeper sleeper;
    private final MetricsRegistry metricsRegistry;

    public RetryEngine(Sleeper sleeper, MetricsRegistry metricsRegistry) {
        this.sleeper = sleeper;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Probe until ready, a fatal outcome, or the policy's attempts run out.
     *
     * @param target label used in logs and metrics
     * @return how the loop ended; never more than {@code policy.maxAttempts()} attempts
     * @throws com.platform.clusterchaos.error.HarnessException the error carried by a FATAL outcome
     */
    public PollResult pollUntilReady(String target, BackoffPolicy policy, Supplier<PollOutcome> probe) {
        String lastReason = null;

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            PollOutcome outcome = probe.get();
            metricsRegistry.recordPollAttempt(target, outcome.kind());

            switch (outcome.kind()) {
                case READY -> {
                    if (attempt > 0) {
                        log.info("{} ready after {} attempts", target, attempt + 1);
                    }
                    return new PollResult(true, attempt + 1, lastReason);
                }
                case FATAL -> {
                    log.error("{} failed permanently on attempt {}: [{}] {}",
                        target, attempt + 1, outcome.code().getCode(), outcome.reason());
                    throw outcome.error();
                }
                case RETRY -> lastReason = outcome.reason();
            }

            log.warn("{} not ready (attempt {}/{}): [{}] {}",
                target, attempt + 1, policy.maxAttempts(), outcome.code().getCode(), lastReason);

            if (attempt + 1 < policy.maxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                log.debug("Retrying {} in {}ms", target, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new HarnessInterruptedException("waiting to retry " + target, ie);
                }
            }
        }

        log.error("{} not ready after {} attempts", target, policy.maxAttempts());
        metricsRegistry.recordRetryExhausted(target);
        return new PollResult(false, policy.maxAttempts(), lastReason);
    }
}
