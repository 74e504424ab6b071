package io.rileyhe1.segmented.Util;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation shared by all segment tasks of one dispatch round. Tripping it wakes tasks
 * sleeping in backoff and closes every registered connection so blocked reads return.
 * Tasks are never interrupted: an interrupt during a FileChannel write would close the
 * channel under every other task.
 */
public class StopSignal
{
    private static final Logger logger = LoggerFactory.getLogger(StopSignal.class);

    private final CountDownLatch tripped = new CountDownLatch(1);
    private final Set<Closeable> resources = ConcurrentHashMap.newKeySet();

    /**
     * Marks the signal tripped and closes registered resources on a separate thread, so
     * the caller never waits for a stalled read to give up its stream.
     */
    public void trip()
    {
        if(tripped.getCount() == 0) return;
        tripped.countDown();
        if(resources.isEmpty()) return;
        List<Closeable> open = new ArrayList<>(resources);
        Thread closer = new Thread(() ->
        {
            for(Closeable resource : open)
            {
                closeQuietly(resource);
            }
        }, "stop-signal-closer");
        closer.setDaemon(true);
        closer.start();
    }

    public boolean isTripped()
    {
        return tripped.getCount() == 0;
    }

    /**
     * Waits up to the given delay.
     *
     * @return true if the signal was tripped before the delay elapsed
     */
    public boolean await(long delayMS) throws InterruptedException
    {
        if(delayMS <= 0) return isTripped();
        return tripped.await(delayMS, TimeUnit.MILLISECONDS);
    }

    public void register(Closeable resource)
    {
        resources.add(resource);
        // lost the race with trip()
        if(isTripped()) closeQuietly(resource);
    }

    public void unregister(Closeable resource)
    {
        resources.remove(resource);
    }

    private static void closeQuietly(Closeable resource)
    {
        try
        {
            resource.close();
        }
        catch(IOException | RuntimeException e)
        {
            logger.debug("Closing {} on stop failed: {}", resource, e.getMessage());
        }
    }
}
