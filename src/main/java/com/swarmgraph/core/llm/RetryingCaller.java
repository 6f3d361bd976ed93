package com.swarmgraph.core.llm;

import com.swarmgraph.core.engine.CancellationToken;
import com.swarmgraph.core.engine.RunCancelledException;
import com.swarmgraph.core.metrics.SwarmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded-retry wrapper around calls to a {@link GenerationService}.
 * <p>
 * Attempt {@code k} (0-based) that fails is followed by a pause of
 * {@code 2^k * baseDelay}; there is no pause after the last attempt. The backoff is
 * deterministic. A cancelled {@link CancellationToken} stops the loop between attempts.
 */
@Component
public class RetryingCaller {

    private static final Logger log = LoggerFactory.getLogger(RetryingCaller.class);

    private final int defaultMaxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;
    private final SwarmMetrics metrics;

    @Autowired
    public RetryingCaller(RetryProperties properties,
                          @Autowired(required = false) SwarmMetrics metrics) {
        this(properties.getMaxAttempts(), properties.getBaseDelay(), Sleeper.SYSTEM, metrics);
    }

    public RetryingCaller(int defaultMaxAttempts, Duration baseDelay, Sleeper sleeper) {
        this(defaultMaxAttempts, baseDelay, sleeper, null);
    }

    RetryingCaller(int defaultMaxAttempts, Duration baseDelay, Sleeper sleeper, SwarmMetrics metrics) {
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public <T> T callWithRetry(Callable<T> fn) {
        return callWithRetry(fn, defaultMaxAttempts, CancellationToken.NONE);
    }

    public <T> T callWithRetry(Callable<T> fn, int maxAttempts) {
        return callWithRetry(fn, maxAttempts, CancellationToken.NONE);
    }

    /**
     * Runs {@code fn} until it succeeds or {@code maxAttempts} attempts have failed.
     *
     * @throws GenerationFailure     carrying the last error once every attempt failed
     * @throws RunCancelledException if {@code token} is cancelled between attempts
     */
    public <T> T callWithRetry(Callable<T> fn, int maxAttempts, CancellationToken token) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Exception lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            token.throwIfCancelled();
            try {
                return fn.call();
            } catch (RunCancelledException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                if (attempt < maxAttempts - 1) {
                    Duration delay = backoffFor(attempt);
                    log.warn("Generation attempt {}/{} failed: {} (retrying in {} ms)",
                            attempt + 1, maxAttempts, e.getMessage(), delay.toMillis());
                    if (metrics != null) {
                        metrics.recordGenerationRetry();
                    }
                    pause(delay, token);
                } else {
                    log.error("Generation attempt {}/{} failed: {}", attempt + 1, maxAttempts, e.getMessage());
                }
            }
        }
        throw new GenerationFailure("Generation failed after " + maxAttempts + " attempt(s): "
                + lastError.getMessage(), lastError, maxAttempts);
    }

    public Duration backoffFor(int attempt) {
        return baseDelay.multipliedBy(1L << attempt);
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    private void pause(Duration delay, CancellationToken token) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while backing off between generation attempts");
        }
        token.throwIfCancelled();
    }
}
