package io.rileyhe1.segmented.Data;

/**
 * One progress observation for a single segment of a transfer.
 */
public class ProgressEvent
{
    private final String transferId;
    private final int segmentIndex;
    private final long bytesWritten;
    private final SegmentState state;
    private final double bytesPerSecond;

    public ProgressEvent(String transferId, int segmentIndex, long bytesWritten, SegmentState state, double bytesPerSecond)
    {
        this.transferId = transferId;
        this.segmentIndex = segmentIndex;
        this.bytesWritten = bytesWritten;
        this.state = state;
        this.bytesPerSecond = bytesPerSecond;
    }

    public String getTransferId()
    {
        return transferId;
    }

    public int getSegmentIndex()
    {
        return segmentIndex;
    }

    public long getBytesWritten()
    {
        return bytesWritten;
    }

    public SegmentState getState()
    {
        return state;
    }

    public double getBytesPerSecond()
    {
        return bytesPerSecond;
    }

    @Override
    public String toString()
    {
        return "ProgressEvent{" + transferId + "#" + segmentIndex + " " + state + " " + bytesWritten + "B"
            + String.format(" %.1f B/s", bytesPerSecond) + "}";
    }
}
