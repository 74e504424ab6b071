package io.rileyhe1.segmented.Data;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A half-open byte range [start, end) of the resource plus its fetch progress.
 * The written counter and state are mutated only by the task that owns the segment;
 * every other thread just reads them.
 */
public class Segment
{
    // end value for a segment whose length is not known (chunked responses)
    public static final long UNBOUNDED = -1L;

    private final int index;
    private final long start;
    private final long end;

    private final AtomicLong written = new AtomicLong(0);
    private final AtomicInteger attempts = new AtomicInteger(0);
    private volatile SegmentState state = SegmentState.PENDING;
    private volatile FailureKind failureKind;
    private volatile String failureReason;

    public Segment(int index, long start, long end)
    {
        if(index < 0) throw new IllegalArgumentException("Segment index cannot be negative");
        if(start < 0) throw new IllegalArgumentException("Start cannot be negative");
        if(end != UNBOUNDED && end < start)
        {
            throw new IllegalArgumentException("End cannot be less than start. Start: " + start + ", End: " + end);
        }
        if(end == UNBOUNDED && start != 0)
        {
            throw new IllegalArgumentException("Only a segment starting at 0 can be unbounded");
        }
        this.index = index;
        this.start = start;
        this.end = end;
    }

    public static Segment fromRecord(int index, SegmentRecord record)
    {
        Segment segment = new Segment(index, record.getStart(), record.getEnd());
        long length = segment.length();
        if(record.getWritten() < 0 || (length != UNBOUNDED && record.getWritten() > length))
        {
            throw new IllegalArgumentException("Recorded progress " + record.getWritten() + " is outside segment " + index);
        }
        segment.written.set(record.getWritten());
        segment.attempts.set(Math.max(0, record.getAttempts()));
        SegmentState recorded = record.getState() == null ? SegmentState.PENDING : record.getState();
        // an in-flight segment at crash time is simply pending again
        segment.state = recorded == SegmentState.ACTIVE ? SegmentState.PENDING : recorded;
        if(segment.state == SegmentState.DONE && length != UNBOUNDED && record.getWritten() != length)
        {
            throw new IllegalArgumentException("Segment " + index + " is recorded done with " + record.getWritten() + " of " + length + " bytes");
        }
        return segment;
    }

    public SegmentRecord toRecord()
    {
        // written is read before state so a record never claims more than it saw
        long bytes = written.get();
        SegmentState current = state;
        SegmentState persisted = current == SegmentState.ACTIVE ? SegmentState.PENDING : current;
        return new SegmentRecord(start, end, bytes, persisted, attempts.get());
    }

    public int getIndex()
    {
        return index;
    }

    public long getStart()
    {
        return start;
    }

    public long getEnd()
    {
        return end;
    }

    public boolean isBounded()
    {
        return end != UNBOUNDED;
    }

    public long length()
    {
        return isBounded() ? end - start : UNBOUNDED;
    }

    public long getWritten()
    {
        return written.get();
    }

    // absolute offset of the next byte this segment still needs
    public long nextOffset()
    {
        return start + written.get();
    }

    public long remaining()
    {
        return isBounded() ? length() - written.get() : UNBOUNDED;
    }

    public boolean isFullyWritten()
    {
        return isBounded() && written.get() == length();
    }

    public long addWritten(long bytes)
    {
        return written.addAndGet(bytes);
    }

    public void resetProgress()
    {
        written.set(0);
    }

    public SegmentState getState()
    {
        return state;
    }

    public int getAttempts()
    {
        return attempts.get();
    }

    public int incrementAttempts()
    {
        return attempts.incrementAndGet();
    }

    public void resetAttempts()
    {
        attempts.set(0);
    }

    public FailureKind getFailureKind()
    {
        return failureKind;
    }

    public String getFailureReason()
    {
        return failureReason;
    }

    public void markActive()
    {
        this.state = SegmentState.ACTIVE;
    }

    public void markDone()
    {
        this.failureKind = null;
        this.failureReason = null;
        this.state = SegmentState.DONE;
    }

    public void markFailed(FailureKind kind, String reason)
    {
        this.failureKind = kind;
        this.failureReason = reason;
        this.state = SegmentState.FAILED;
    }

    // back into the queue, either for a retry or after a pause
    public void markPending()
    {
        this.state = SegmentState.PENDING;
    }

    public Segment copy()
    {
        Segment copy = new Segment(index, start, end);
        copy.written.set(written.get());
        copy.attempts.set(attempts.get());
        copy.state = state;
        copy.failureKind = failureKind;
        copy.failureReason = failureReason;
        return copy;
    }

    @Override
    public String toString()
    {
        return "Segment{" + index + ": [" + start + ", " + (isBounded() ? String.valueOf(end) : "?") + ")"
            + ", written=" + written.get() + ", state=" + state + ", attempts=" + attempts.get() + "}";
    }
}
