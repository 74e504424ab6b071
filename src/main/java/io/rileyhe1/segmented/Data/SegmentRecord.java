package io.rileyhe1.segmented.Data;

/**
 * Persisted form of a segment inside a checkpoint.
 */
public class SegmentRecord
{
    private long start;
    private long end;
    private long written;
    private SegmentState state;
    private int attempts;

    // No arg constructor for gson deserialization
    public SegmentRecord()
    {
    }

    public SegmentRecord(long start, long end, long written, SegmentState state, int attempts)
    {
        this.start = start;
        this.end = end;
        this.written = written;
        this.state = state;
        this.attempts = attempts;
    }

    public long getStart()
    {
        return start;
    }

    public long getEnd()
    {
        return end;
    }

    public long getWritten()
    {
        return written;
    }

    public SegmentState getState()
    {
        return state;
    }

    public int getAttempts()
    {
        return attempts;
    }

    public void setStart(long start)
    {
        this.start = start;
    }

    public void setEnd(long end)
    {
        this.end = end;
    }

    public void setWritten(long written)
    {
        this.written = written;
    }

    public void setState(SegmentState state)
    {
        this.state = state;
    }

    public void setAttempts(int attempts)
    {
        this.attempts = attempts;
    }
}
