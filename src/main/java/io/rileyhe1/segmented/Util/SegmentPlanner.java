package io.rileyhe1.segmented.Util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Segment;

/**
 * Partitions [0, totalSize) into contiguous segments. The partition depends only on
 * (totalSize, concurrency, minSegmentSize), so a lost checkpoint can be rebuilt from a
 * re-probed size.
 */
public final class SegmentPlanner
{
    private SegmentPlanner()
    {
    }

    /**
     * Effective concurrency = min(concurrency, max(1, totalSize / minSegmentSize)).
     */
    public static int effectiveConcurrency(long totalSize, int concurrency, long minSegmentSize)
    {
        validate(totalSize, concurrency, minSegmentSize);
        long bySize = Math.max(1L, totalSize / minSegmentSize);
        return (int) Math.min((long) concurrency, bySize);
    }

    /**
     * @param totalSize resource size, or {@link ResourceMetadata#UNKNOWN_SIZE}
     */
    public static List<Segment> plan(long totalSize, int concurrency, long minSegmentSize)
    {
        if(totalSize == ResourceMetadata.UNKNOWN_SIZE)
        {
            if(concurrency < 1) throw new IllegalArgumentException("Concurrency must be at least 1");
            if(minSegmentSize < 1) throw new IllegalArgumentException("Min segment size must be at least 1");
            return singleStream(totalSize);
        }
        if(totalSize == 0)
        {
            validate(totalSize, concurrency, minSegmentSize);
            return singleStream(0);
        }

        int count = effectiveConcurrency(totalSize, concurrency, minSegmentSize);
        long base = totalSize / count;
        long remainder = totalSize % count;

        List<Segment> segments = new ArrayList<>(count);
        long start = 0;
        for(int i = 0; i < count; i++)
        {
            // the first (totalSize % count) segments take one extra byte each
            long size = base + (i < remainder ? 1 : 0);
            segments.add(new Segment(i, start, start + size));
            start += size;
        }
        return Collections.unmodifiableList(segments);
    }

    /**
     * One segment covering the whole resource: [0, totalSize), or unbounded when the
     * size is unknown. An empty resource yields a single segment that is already done.
     */
    public static List<Segment> singleStream(long totalSize)
    {
        Segment segment;
        if(totalSize == ResourceMetadata.UNKNOWN_SIZE)
        {
            segment = new Segment(0, 0, Segment.UNBOUNDED);
        }
        else
        {
            if(totalSize < 0) throw new IllegalArgumentException("Total size cannot be negative: " + totalSize);
            segment = new Segment(0, 0, totalSize);
            if(totalSize == 0) segment.markDone();
        }
        return Collections.singletonList(segment);
    }

    private static void validate(long totalSize, int concurrency, long minSegmentSize)
    {
        if(totalSize < 0) throw new IllegalArgumentException("Total size cannot be negative: " + totalSize);
        if(concurrency < 1) throw new IllegalArgumentException("Concurrency must be at least 1");
        if(minSegmentSize < 1) throw new IllegalArgumentException("Min segment size must be at least 1");
    }
}
