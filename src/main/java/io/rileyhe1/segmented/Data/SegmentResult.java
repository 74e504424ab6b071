package io.rileyhe1.segmented.Data;

/**
 * What a segment task reports back to the coordinator when it stops running.
 */
public class SegmentResult
{
    private final int segmentIndex;
    private final long bytesWritten;
    private final boolean success;
    private final boolean stopped;
    private final DownloadException error;

    private SegmentResult(int segmentIndex, long bytesWritten, boolean success, boolean stopped, DownloadException error)
    {
        this.segmentIndex = segmentIndex;
        this.bytesWritten = bytesWritten;
        this.success = success;
        this.stopped = stopped;
        this.error = error;
    }

    public static SegmentResult success(int segmentIndex, long bytesWritten)
    {
        return new SegmentResult(segmentIndex, bytesWritten, true, false, null);
    }

    public static SegmentResult failure(int segmentIndex, long bytesWritten, DownloadException error)
    {
        if(error == null) throw new IllegalArgumentException("A failed segment needs an error");
        return new SegmentResult(segmentIndex, bytesWritten, false, false, error);
    }

    // the task was told to stop (pause, cancel, or another segment's failure) before it finished
    public static SegmentResult stopped(int segmentIndex, long bytesWritten)
    {
        return new SegmentResult(segmentIndex, bytesWritten, false, true, null);
    }

    public int getSegmentIndex()
    {
        return segmentIndex;
    }

    public long getBytesWritten()
    {
        return bytesWritten;
    }

    public boolean isSuccessful()
    {
        return success;
    }

    public boolean isStopped()
    {
        return stopped;
    }

    public DownloadException getError()
    {
        return error;
    }

    public FailureKind getFailureKind()
    {
        return error != null ? error.getKind() : null;
    }
}
