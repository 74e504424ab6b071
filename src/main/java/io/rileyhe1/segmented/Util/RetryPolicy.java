package io.rileyhe1.segmented.Util;

import java.io.IOException;

import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Net.HttpStatusException;

/**
 * Classifies fetch failures and decides whether and when a segment is tried again.
 * Delays grow exponentially from the initial delay and are capped.
 */
public class RetryPolicy
{
    private final int maxAttempts;
    private final long initialDelayMS;
    private final long maxDelayMS;
    private final double multiplier;

    public RetryPolicy(DownloadConfig config)
    {
        this(config.getMaxAttempts(), config.getRetryDelayMS(), config.getMaxRetryDelayMS(), config.getBackoffMultiplier());
    }

    public RetryPolicy(int maxAttempts, long initialDelayMS, long maxDelayMS, double multiplier)
    {
        if(maxAttempts < 1) throw new IllegalArgumentException("Max attempts must be at least 1");
        if(initialDelayMS < 0 || maxDelayMS < 0) throw new IllegalArgumentException("Delays cannot be negative");
        if(multiplier < 1.0) throw new IllegalArgumentException("Multiplier must be at least 1.0");
        this.maxAttempts = maxAttempts;
        this.initialDelayMS = initialDelayMS;
        this.maxDelayMS = Math.max(initialDelayMS, maxDelayMS);
        this.multiplier = multiplier;
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    public FailureKind classify(Throwable error)
    {
        if(error instanceof DownloadException)
        {
            return ((DownloadException) error).getKind();
        }
        if(error instanceof HttpStatusException)
        {
            int status = ((HttpStatusException) error).getStatusCode();
            if(status == HttpStatusException.PRECONDITION_FAILED) return FailureKind.VALIDATOR_MISMATCH;
            if(status == HttpStatusException.RANGE_NOT_SATISFIABLE) return FailureKind.RANGE_UNSUPPORTED;
            if(status == 404 || status == 410) return FailureKind.RESOURCE_NOT_FOUND;
            if(status == 408 || status == 429 || (status >= 500 && status < 600)) return FailureKind.CONNECTION_TRANSIENT;
            return FailureKind.FATAL;
        }
        // resets, timeouts, refused connections, DNS hiccups, premature EOF
        if(error instanceof IOException)
        {
            return FailureKind.CONNECTION_TRANSIENT;
        }
        return FailureKind.FATAL;
    }

    /**
     * Wraps a raw failure into a classified {@link DownloadException}.
     */
    public DownloadException toDownloadException(Throwable error, String context)
    {
        if(error instanceof DownloadException) return (DownloadException) error;
        FailureKind kind = classify(error);
        return new DownloadException(kind, context + ": " + error.getMessage(), error);
    }

    /**
     * @param attemptsMade attempts already made for the segment, including the one that just failed
     */
    public boolean shouldRetry(FailureKind kind, int attemptsMade)
    {
        return kind != null && kind.isRetryable() && attemptsMade < maxAttempts;
    }

    /**
     * Delay before the next try after the given number of failed attempts.
     */
    public long backoffDelay(int attemptsMade)
    {
        if(attemptsMade < 1) return 0;
        double delay = initialDelayMS * Math.pow(multiplier, attemptsMade - 1);
        if(delay >= maxDelayMS || Double.isInfinite(delay)) return maxDelayMS;
        return (long) delay;
    }
}
