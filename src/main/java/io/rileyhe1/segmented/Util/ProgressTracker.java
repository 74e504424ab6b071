package io.rileyhe1.segmented.Util;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.DownloadResult;
import io.rileyhe1.segmented.Data.ProgressEvent;
import io.rileyhe1.segmented.Data.Segment;

/**
 * Per-segment byte counters for one transfer, plus throttled fan-out of progress events.
 */
public class ProgressTracker
{
    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final String transferId;
    private final long eventIntervalMS;
    private final ConcurrentHashMap<Integer, AtomicLong> segmentProgress = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, SpeedSample> speedSamples = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Long> lastEventNanos = new ConcurrentHashMap<>();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    public ProgressTracker(String transferId, long eventIntervalMS)
    {
        if(transferId == null || transferId.isEmpty()) throw new IllegalArgumentException("Transfer id cannot be null or empty");
        if(eventIntervalMS < 0) throw new IllegalArgumentException("Event interval cannot be negative");
        this.transferId = transferId;
        this.eventIntervalMS = eventIntervalMS;
    }

    public String getTransferId()
    {
        return transferId;
    }

    public void addListener(ProgressListener listener)
    {
        if(listener == null) throw new IllegalArgumentException("Listener cannot be null");
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener)
    {
        listeners.remove(listener);
    }

    /**
     * Replaces all counters with the recorded progress of the given plan.
     */
    public void reset(List<Segment> segments)
    {
        segmentProgress.clear();
        speedSamples.clear();
        lastEventNanos.clear();
        for(Segment segment : segments)
        {
            segmentProgress.put(segment.getIndex(), new AtomicLong(segment.getWritten()));
        }
    }

    public void updateProgress(int segmentIndex, long bytes)
    {
        segmentProgress.computeIfAbsent(segmentIndex, (k) -> new AtomicLong(0))
            .addAndGet(bytes);
    }

    public void setProgress(int segmentIndex, long bytes)
    {
        segmentProgress.computeIfAbsent(segmentIndex, (k) -> new AtomicLong(0))
            .set(bytes);
    }

    public long getSegmentProgress(int segmentIndex)
    {
        AtomicLong progress = segmentProgress.get(segmentIndex);
        return progress == null ? 0 : progress.get();
    }

    public long getTotalProgress()
    {
        return segmentProgress.values().stream()
                .mapToLong(AtomicLong::get)
                .sum();
    }

    public double getProgressPercentage(long totalSize)
    {
        if(totalSize <= 0) return totalSize == 0 ? 100.0 : 0.0;
        return (double) getTotalProgress() / totalSize * 100;
    }

    // starts a fresh speed window for a segment attempt
    public void markAttemptStart(int segmentIndex, long bytesWritten)
    {
        speedSamples.put(segmentIndex, new SpeedSample(System.nanoTime(), bytesWritten));
    }

    public double getBytesPerSecond(int segmentIndex)
    {
        SpeedSample sample = speedSamples.get(segmentIndex);
        if(sample == null) return 0.0;
        long elapsedNanos = System.nanoTime() - sample.startNanos;
        if(elapsedNanos <= 0) return 0.0;
        long bytes = getSegmentProgress(segmentIndex) - sample.startBytes;
        return Math.max(0, bytes) * 1_000_000_000.0 / elapsedNanos;
    }

    public double getBytesPerSecond()
    {
        double total = 0;
        for(Integer index : speedSamples.keySet())
        {
            total += getBytesPerSecond(index);
        }
        return total;
    }

    /**
     * Emits a progress event for the segment. Unforced reports are dropped if the previous
     * event for the same segment was less than the event interval ago.
     */
    public void report(Segment segment, boolean force)
    {
        if(listeners.isEmpty()) return;
        long now = System.nanoTime();
        if(!force)
        {
            Long last = lastEventNanos.get(segment.getIndex());
            if(last != null && now - last < eventIntervalMS * 1_000_000L) return;
        }
        lastEventNanos.put(segment.getIndex(), now);

        ProgressEvent event = new ProgressEvent(transferId, segment.getIndex(), segment.getWritten(),
            segment.getState(), getBytesPerSecond(segment.getIndex()));
        for(ProgressListener listener : listeners)
        {
            try
            {
                listener.onProgress(event);
            }
            catch(RuntimeException e)
            {
                logger.warn("Progress listener {} failed for transfer {}", listener, transferId, e);
            }
        }
    }

    public void fireFinished(DownloadResult result)
    {
        for(ProgressListener listener : listeners)
        {
            try
            {
                listener.onFinished(result);
            }
            catch(RuntimeException e)
            {
                logger.warn("Progress listener {} failed on completion of transfer {}", listener, transferId, e);
            }
        }
    }

    private static final class SpeedSample
    {
        private final long startNanos;
        private final long startBytes;

        private SpeedSample(long startNanos, long startBytes)
        {
            this.startNanos = startNanos;
            this.startBytes = startBytes;
        }
    }
}
