package io.rileyhe1.segmented.Data;

public enum DownloadState
{
    PLANNING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal()
    {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
