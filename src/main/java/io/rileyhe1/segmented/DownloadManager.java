package io.rileyhe1.segmented;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.Checkpoint;
import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.DownloadResult;
import io.rileyhe1.segmented.Data.DownloadState;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Net.HttpRangeConnection;
import io.rileyhe1.segmented.Net.RangeConnection;
import io.rileyhe1.segmented.Net.ResourceProber;
import io.rileyhe1.segmented.Store.CheckpointStore;
import io.rileyhe1.segmented.Store.JsonCheckpointStore;
import io.rileyhe1.segmented.Util.Download;

/**
 * Keeps several transfers that share a configuration, a connection and a checkpoint store.
 */
public class DownloadManager
{
    private static final Logger logger = LoggerFactory.getLogger(DownloadManager.class);

    private static final long SHUTDOWN_WAIT_MS = 10_000;

    private final Map<String, Download> downloads = new ConcurrentHashMap<>();
    private final DownloadConfig config;
    private final RangeConnection connection;
    private final CheckpointStore checkpointStore;

    public DownloadManager(DownloadConfig config) throws IOException
    {
        this(config, new HttpRangeConnection(requireConfig(config)),
            new JsonCheckpointStore(config.getCheckpointDirectory(), config.getCheckpointMaxAgeMS()));
    }

    public DownloadManager(DownloadConfig config, RangeConnection connection, CheckpointStore checkpointStore)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        if(connection == null) throw new IllegalArgumentException("Connection cannot be null");
        if(checkpointStore == null) throw new IllegalArgumentException("Checkpoint store cannot be null");
        this.config = config;
        this.connection = connection;
        this.checkpointStore = checkpointStore;
    }

    private static DownloadConfig requireConfig(DownloadConfig config)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        return config;
    }

    public synchronized Download startDownload(String url, String destination)
    {
        // input validation
        if(url == null || url.trim().isEmpty()) throw new IllegalArgumentException("url cannot be empty/null");
        if(destination == null || destination.trim().isEmpty()) throw new IllegalArgumentException("destination cannot be empty/null");

        Download download = new Download(url, destination, config, connection, checkpointStore);
        // check for other transfers already writing to the given destination
        for(Download existing : downloads.values())
        {
            if(existing.getDestination().equals(download.getDestination()) && !existing.getState().isTerminal())
            {
                throw new IllegalArgumentException("Invalid destination, download " + existing.getId() + " is already using " + download.getDestination());
            }
        }
        downloads.put(download.getId(), download);
        download.start();
        return download;
    }

    /**
     * Probes the resource for a file name (Content-Disposition, else the URL path) and
     * downloads it into the given directory.
     */
    public Download startDownloadToDirectory(String url, String directory) throws DownloadException
    {
        if(url == null || url.trim().isEmpty()) throw new IllegalArgumentException("url cannot be empty/null");
        if(directory == null || directory.trim().isEmpty()) throw new IllegalArgumentException("directory cannot be empty/null");

        URI uri;
        try
        {
            uri = URI.create(url.trim());
        }
        catch(IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        ResourceMetadata metadata = new ResourceProber(connection).probe(uri);
        Path name = Paths.get(metadata.getFileName()).getFileName();
        String fileName = name == null ? ResourceProber.DEFAULT_FILE_NAME : name.toString();
        return startDownload(url, Paths.get(directory).resolve(fileName).toString());
    }

    public void pauseDownload(String downloadId)
    {
        lookup(downloadId).pause();
    }

    public synchronized void resumeDownload(String downloadId)
    {
        Download download = lookup(downloadId);
        if(isResumableFailure(download) && checkpointStore.load(downloadId).isPresent())
        {
            replace(download).start();
        }
        // loaded from a checkpoint but not started yet
        else if(!download.isStarted())
        {
            download.start();
        }
        else if(download.getState() == DownloadState.PAUSED)
        {
            download.resume();
        }
        else
        {
            throw new IllegalStateException("Cannot resume download in state: " + download.getState());
        }
    }

    public void cancelDownload(String downloadId)
    {
        Download download = lookup(downloadId);
        download.cancel();
        downloads.remove(downloadId);
    }

    /**
     * Registers a (not yet started) transfer for every checkpoint in the store that is not
     * already known. A known transfer that failed in a resumable way is replaced by a fresh one
     * that will continue from its checkpoint.
     *
     * @return the transfers that were added
     */
    public synchronized List<Download> loadDownloads()
    {
        List<Download> loaded = new ArrayList<>();
        for(Checkpoint checkpoint : checkpointStore.loadAll())
        {
            Download existing = downloads.get(checkpoint.getId());
            if(existing != null)
            {
                if(isResumableFailure(existing)) loaded.add(replace(existing));
                continue;
            }
            Download download;
            try
            {
                download = new Download(checkpoint.getUrl(), checkpoint.getDestination(), config, connection, checkpointStore);
            }
            catch(IllegalArgumentException e)
            {
                logger.warn("Skipping checkpoint {}: {}", checkpoint.getId(), e.getMessage());
                continue;
            }
            if(!download.getId().equals(checkpoint.getId()))
            {
                logger.warn("Skipping checkpoint {}: it does not belong to {} -> {}", checkpoint.getId(), checkpoint.getUrl(), checkpoint.getDestination());
                continue;
            }
            downloads.put(download.getId(), download);
            loaded.add(download);
        }
        if(!loaded.isEmpty()) logger.info("Loaded {} persisted download(s) from {}", loaded.size(), config.getCheckpointDirectory());
        return loaded;
    }

    /**
     * Loads persisted transfers and starts every one that is not running.
     *
     * @return the transfers that were started or resumed
     */
    public synchronized List<Download> resumeAll()
    {
        loadDownloads();
        List<Download> resumed = new ArrayList<>();
        for(Download download : new ArrayList<>(downloads.values()))
        {
            if(!download.isStarted())
            {
                download.start();
                resumed.add(download);
            }
            else if(download.getState() == DownloadState.PAUSED)
            {
                download.resume();
                resumed.add(download);
            }
        }
        return resumed;
    }

    public Download getDownload(String downloadId)
    {
        if(downloadId == null) return null;
        return downloads.get(downloadId);
    }

    public List<Download> getAllDownloads()
    {
        return new ArrayList<>(downloads.values());
    }

    /**
     * Pauses every running transfer and waits for their checkpoints to be flushed.
     */
    public void shutdown()
    {
        List<Download> pausing = new ArrayList<>();
        for(Download download : downloads.values())
        {
            if(!download.isStarted() || download.getState().isTerminal()) continue;
            try
            {
                download.pause();
                pausing.add(download);
            }
            catch(IllegalStateException e)
            {
                // finished between the check and the pause
                logger.debug("Download {} did not need pausing: {}", download.getId(), e.getMessage());
            }
        }

        for(Download download : pausing)
        {
            try
            {
                if(!download.awaitIdle(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS))
                {
                    logger.warn("Download {} did not pause within {} ms", download.getId(), SHUTDOWN_WAIT_MS);
                }
            }
            catch(InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.info("Download manager shut down, {} transfer(s) paused", pausing.size());
        downloads.clear();
    }

    // failed, but its checkpoint can still be picked up by a new run
    private static boolean isResumableFailure(Download download)
    {
        DownloadResult result = download.getResult();
        return download.getState() == DownloadState.FAILED && result != null && result.isResumable();
    }

    private Download replace(Download failed)
    {
        Download fresh = new Download(failed.getUrl(), failed.getDestination(), config, connection, checkpointStore);
        downloads.put(fresh.getId(), fresh);
        logger.info("Download {} failed earlier ({}), retrying from its checkpoint", fresh.getId(), failed.getResult().getOutcome());
        return fresh;
    }

    private Download lookup(String downloadId)
    {
        if(downloadId == null || downloadId.trim().isEmpty()) throw new IllegalArgumentException("download id cannot be null/empty");
        Download download = downloads.get(downloadId);
        if(download == null) throw new IllegalArgumentException("Invalid download id, download is not present in downloads map");
        return download;
    }
}
