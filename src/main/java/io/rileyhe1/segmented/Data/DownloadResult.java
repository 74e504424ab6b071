package io.rileyhe1.segmented.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal outcome of a transfer, as handed to callers and listeners.
 */
public class DownloadResult
{
    private final String transferId;
    private final DownloadOutcome outcome;
    private final DownloadState state;
    private final FailureKind failureKind;
    private final String reason;
    private final boolean resumable;
    private final long finalSize;
    private final String destination;
    private final Map<Integer, String> segmentFailures;

    private DownloadResult(String transferId, DownloadOutcome outcome, DownloadState state, FailureKind failureKind,
                           String reason, boolean resumable, long finalSize, String destination,
                           Map<Integer, String> segmentFailures)
    {
        this.transferId = transferId;
        this.outcome = outcome;
        this.state = state;
        this.failureKind = failureKind;
        this.reason = reason;
        this.resumable = resumable;
        this.finalSize = finalSize;
        this.destination = destination;
        this.segmentFailures = segmentFailures == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(segmentFailures));
    }

    public static DownloadResult completed(String transferId, String destination, long finalSize)
    {
        return new DownloadResult(transferId, DownloadOutcome.SUCCESS, DownloadState.COMPLETED, null,
            null, false, finalSize, destination, null);
    }

    public static DownloadResult failed(String transferId, String destination, DownloadException error,
                                        Map<Integer, String> segmentFailures)
    {
        DownloadOutcome outcome = error.getKind() == FailureKind.CONNECTION_TRANSIENT
            ? DownloadOutcome.RETRYABLE_FAILURE_EXHAUSTED
            : DownloadOutcome.FATAL_FAILURE;
        return new DownloadResult(transferId, outcome, DownloadState.FAILED, error.getKind(),
            error.getMessage(), error.isResumable(), -1L, destination, segmentFailures);
    }

    public static DownloadResult cancelled(String transferId, String destination)
    {
        return new DownloadResult(transferId, DownloadOutcome.USER_CANCELLED, DownloadState.CANCELLED,
            FailureKind.CANCELLED, "Cancelled by user", false, -1L, destination, null);
    }

    public String getTransferId()
    {
        return transferId;
    }

    public DownloadOutcome getOutcome()
    {
        return outcome;
    }

    public DownloadState getState()
    {
        return state;
    }

    public boolean isSuccessful()
    {
        return outcome == DownloadOutcome.SUCCESS;
    }

    public FailureKind getFailureKind()
    {
        return failureKind;
    }

    public String getReason()
    {
        return reason;
    }

    public boolean isResumable()
    {
        return resumable;
    }

    // -1 unless the transfer completed
    public long getFinalSize()
    {
        return finalSize;
    }

    public String getDestination()
    {
        return destination;
    }

    // last failure per failed segment, keyed by segment index
    public Map<Integer, String> getSegmentFailures()
    {
        return segmentFailures;
    }

    public int getExitCode()
    {
        return outcome.getExitCode();
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("DownloadResult{").append(transferId).append(' ').append(outcome);
        if(isSuccessful())
        {
            sb.append(", size=").append(finalSize);
        }
        else
        {
            sb.append(", reason=").append(reason).append(", resumable=").append(resumable);
            if(!segmentFailures.isEmpty()) sb.append(", segments=").append(segmentFailures);
        }
        return sb.append('}').toString();
    }
}
