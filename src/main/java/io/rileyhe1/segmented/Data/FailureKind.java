package io.rileyhe1.segmented.Data;

/**
 * Classification of everything that can go wrong while driving a transfer.
 * The retry policy maps raw I/O failures onto these kinds, and the coordinator
 * decides what happens to the whole transfer from the kind alone. A corrupt checkpoint
 * is not among them; the store treats it as absent.
 */
public enum FailureKind
{
    PROBE_FAILED(false, true, true),
    RESOURCE_NOT_FOUND(false, true, true),
    RANGE_UNSUPPORTED(false, false, true),
    VALIDATOR_MISMATCH(false, false, false),
    CONNECTION_TRANSIENT(true, false, true),
    DISK_IO(false, true, true),
    PROTOCOL_VIOLATION(false, true, true),
    FATAL(false, true, true),
    CANCELLED(false, false, false);

    private final boolean retryable;
    private final boolean abortsTransfer;
    private final boolean resumable;

    FailureKind(boolean retryable, boolean abortsTransfer, boolean resumable)
    {
        this.retryable = retryable;
        this.abortsTransfer = abortsTransfer;
        this.resumable = resumable;
    }

    // retried in place by the segment that hit it
    public boolean isRetryable()
    {
        return retryable;
    }

    // stops every other segment and fails the transfer immediately
    public boolean abortsTransfer()
    {
        return abortsTransfer;
    }

    // whether a later run may pick the transfer up from its checkpoint
    public boolean isResumable()
    {
        return resumable;
    }
}
