package io.rileyhe1.segmented.Data;

public enum DownloadOutcome
{
    SUCCESS(0),
    RETRYABLE_FAILURE_EXHAUSTED(75),
    FATAL_FAILURE(1),
    USER_CANCELLED(130);

    private final int exitCode;

    DownloadOutcome(int exitCode)
    {
        this.exitCode = exitCode;
    }

    public int getExitCode()
    {
        return exitCode;
    }
}
