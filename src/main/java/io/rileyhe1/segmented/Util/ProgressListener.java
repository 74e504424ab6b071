package io.rileyhe1.segmented.Util;

import io.rileyhe1.segmented.Data.DownloadResult;
import io.rileyhe1.segmented.Data.ProgressEvent;

/**
 * Receives progress from a transfer. Called from worker threads; implementations must
 * be thread safe and quick.
 */
public interface ProgressListener
{
    void onProgress(ProgressEvent event);

    // exactly once, when the transfer reaches a terminal state
    default void onFinished(DownloadResult result)
    {
    }
}
