package io.rileyhe1.segmented.Util;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.Checkpoint;
import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.DownloadResult;
import io.rileyhe1.segmented.Data.DownloadState;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Segment;
import io.rileyhe1.segmented.Data.SegmentRecord;
import io.rileyhe1.segmented.Data.SegmentResult;
import io.rileyhe1.segmented.Data.SegmentState;
import io.rileyhe1.segmented.Data.TransferMode;
import io.rileyhe1.segmented.Data.Validator;
import io.rileyhe1.segmented.Net.RangeConnection;
import io.rileyhe1.segmented.Net.ResourceProber;
import io.rileyhe1.segmented.Store.CheckpointStore;

/**
 * One transfer of one URL to one destination.
 *
 * <p>All plan changes, checkpoint writes and file lifecycle steps happen on a single
 * coordinator thread. Segment tasks only write their own byte range and their own
 * segment's counters; the coordinator learns about them through a completion queue.
 *
 * <p>Bytes go to {@code <destination>.part}, which is moved onto the destination only
 * after every segment is done.
 */
public class Download
{
    private static final Logger logger = LoggerFactory.getLogger(Download.class);

    private enum Request
    {
        PAUSE,
        CANCEL
    }

    private final String id;
    private final String url;
    private final URI uri;
    private final String destination;
    private final Path destinationPath;
    private final Path partFile;
    private final DownloadConfig config;
    private final RangeConnection connection;
    private final CheckpointStore checkpointStore;
    private final ResourceProber prober;
    private final RetryPolicy retryPolicy;
    private final ProgressTracker progressTracker;
    private final ExecutorService coordinator;
    private final CompletableFuture<DownloadResult> completion = new CompletableFuture<>();

    // current plan; replaced wholesale, only by the coordinator
    private volatile List<Segment> segments = Collections.emptyList();
    private volatile long totalSize = ResourceMetadata.UNKNOWN_SIZE;
    private volatile Validator validator;
    private volatile TransferMode mode;
    private volatile String modeReason;
    private volatile int concurrency;
    private volatile ResourceMetadata metadata;
    private volatile boolean restoredFromCheckpoint;

    private volatile DownloadState state = DownloadState.PLANNING;
    private volatile boolean started;
    private volatile boolean running;
    private volatile Request request;
    private volatile StopSignal stopSignal = new StopSignal();
    private volatile DownloadResult result;

    // coordinator only
    private FileChannel channel;
    private int planRestarts;

    public Download(String url, String destination, DownloadConfig config, RangeConnection connection,
                    CheckpointStore checkpointStore)
    {
        // validate arguments
        if(url == null || url.trim().isEmpty()) throw new IllegalArgumentException("URL cannot be null or empty!");
        if(destination == null || destination.trim().isEmpty()) throw new IllegalArgumentException("Destination cannot be null or empty!");
        if(config == null) throw new IllegalArgumentException("Config cannot be null!");
        if(connection == null) throw new IllegalArgumentException("Connection cannot be null!");
        if(checkpointStore == null) throw new IllegalArgumentException("Checkpoint store cannot be null!");

        this.url = url.trim();
        try
        {
            this.uri = new URI(this.url);
        }
        catch(URISyntaxException e)
        {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        if(!uri.isAbsolute()) throw new IllegalArgumentException("URL must be absolute: " + url);

        this.destinationPath = normalize(destination);
        this.destination = destinationPath.toString();
        this.partFile = TransferFinalizer.partFileFor(destinationPath);
        this.id = transferIdFor(this.url, this.destination);
        this.config = config;
        this.connection = connection;
        this.checkpointStore = checkpointStore;
        this.prober = new ResourceProber(connection);
        this.retryPolicy = new RetryPolicy(config);
        this.progressTracker = new ProgressTracker(id, config.getProgressIntervalMS());
        this.coordinator = Executors.newSingleThreadExecutor(threadFactory("download"));
    }

    /**
     * Stable id for a (url, destination) pair, so a restarted process finds its checkpoint.
     */
    public static String transferIdFor(String url, String destination)
    {
        if(url == null || destination == null) throw new IllegalArgumentException("URL and destination are required");
        String key = url.trim() + "\n" + normalize(destination);
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Path normalize(String destination)
    {
        return Paths.get(destination.trim()).toAbsolutePath().normalize();
    }

    // ==================== LIFECYCLE ====================

    /**
     * Plans (or restores) the transfer and starts fetching in the background.
     */
    public synchronized void start()
    {
        if(started) throw new IllegalStateException("Download " + id + " has already been started");
        started = true;
        logger.info("Starting download {}: {} -> {}", id, url, destination);
        launch();
    }

    /**
     * Asks the transfer to stop at the next opportunity. Active connections are closed and
     * the checkpoint is flushed; the state becomes PAUSED once that has happened.
     */
    public synchronized void pause()
    {
        if(!started) throw new IllegalStateException("Cannot pause a download that has not been started");
        if(state.isTerminal()) throw new IllegalStateException("Cannot pause a download that is " + state);
        if(request != null || !running) return;
        request = Request.PAUSE;
        stopSignal.trip();
        logger.debug("Pause requested for download {}", id);
    }

    public synchronized void resume()
    {
        if(state != DownloadState.PAUSED || running)
        {
            throw new IllegalStateException("Cannot resume a download that is " + state);
        }
        request = null;
        logger.info("Resuming download {}", id);
        launch();
    }

    /**
     * Stops the transfer and removes its part file and checkpoint. Has no effect once the
     * transfer is terminal.
     */
    public synchronized void cancel()
    {
        if(state.isTerminal()) return;
        started = true;
        request = Request.CANCEL;
        stopSignal.trip();
        if(!running) launch();
    }

    /**
     * Blocks until the transfer is terminal. A paused transfer keeps this waiting.
     */
    public DownloadResult awaitCompletion() throws InterruptedException
    {
        try
        {
            return completion.get();
        }
        catch(ExecutionException e)
        {
            throw new IllegalStateException("Download " + id + " finished abnormally", e.getCause());
        }
    }

    public DownloadResult awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException
    {
        try
        {
            return completion.get(timeout, unit);
        }
        catch(ExecutionException e)
        {
            throw new IllegalStateException("Download " + id + " finished abnormally", e.getCause());
        }
    }

    public void addListener(ProgressListener listener)
    {
        progressTracker.addListener(listener);
    }

    public void removeListener(ProgressListener listener)
    {
        progressTracker.removeListener(listener);
    }

    private void launch()
    {
        running = true;
        coordinator.submit(this::run);
    }

    private void run()
    {
        DownloadResult outcome;
        try
        {
            outcome = drive();
        }
        catch(DownloadException e)
        {
            outcome = fail(e, Collections.emptyMap());
        }
        catch(RuntimeException e)
        {
            logger.error("Download {} crashed", id, e);
            outcome = fail(new DownloadException(FailureKind.FATAL, "Unexpected error: " + e.getMessage(), e),
                Collections.emptyMap());
        }

        synchronized(this)
        {
            if(outcome == null && request == Request.CANCEL)
            {
                // a cancel that arrived while the pause was being flushed
                launch();
                return;
            }
            running = false;
            if(outcome == null)
            {
                state = DownloadState.PAUSED;
            }
            else
            {
                result = outcome;
                state = outcome.getState();
            }
            notifyAll();
        }
        if(outcome != null) finish(outcome);
    }

    /**
     * Waits until no coordinator pass is running, i.e. the transfer is paused, terminal
     * or not started.
     *
     * @return false if the timeout elapsed first
     */
    public synchronized boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException
    {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while(running)
        {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if(remaining <= 0) return false;
            wait(remaining);
        }
        return true;
    }

    /**
     * @return the terminal result, or null if the transfer paused
     */
    private DownloadResult drive() throws DownloadException
    {
        while(true)
        {
            // publish the round's signal before looking at requests so a racing pause trips it
            StopSignal signal = new StopSignal();
            stopSignal = signal;
            if(request != null) return handleRequest();

            if(segments.isEmpty())
            {
                state = DownloadState.PLANNING;
                if(!restore()) plan();
                continue;
            }

            state = DownloadState.ACTIVE;
            Round round = runRound(signal);
            switch(round.action)
            {
                case COMPLETE:
                    return complete();
                case DEMOTE:
                    demote(round.error);
                    break;
                case REPLAN:
                    restartPlan(round.error);
                    break;
                case FAIL:
                    return fail(round.error, round.failures);
                default:
                    // stopped: the next pass handles the request
                    break;
            }
        }
    }

    private DownloadResult handleRequest()
    {
        if(request == Request.CANCEL)
        {
            closeChannelQuietly();
            deleteQuietly(partFile);
            deleteCheckpointQuietly();
            logger.info("Download {} cancelled", id);
            return DownloadResult.cancelled(id, destination);
        }

        try
        {
            persistCheckpoint(DownloadState.PAUSED);
        }
        catch(DownloadException e)
        {
            // the periodic checkpoint stays valid, only newer progress is lost
            logger.warn("Could not flush checkpoint for paused download {}: {}", id, e.getMessage());
        }
        closeChannelQuietly();
        logger.info("Download {} paused at {} of {} bytes", id, progressTracker.getTotalProgress(), totalSize);
        return null;
    }

    private void finish(DownloadResult outcome)
    {
        progressTracker.fireFinished(outcome);
        completion.complete(outcome);
        coordinator.shutdown();
    }

    // ==================== PLANNING ====================

    private boolean restore()
    {
        Optional<Checkpoint> found = checkpointStore.load(id);
        if(!found.isPresent()) return false;
        Checkpoint checkpoint = found.get();

        if(!url.equals(checkpoint.getUrl()) || !destination.equals(checkpoint.getDestination()))
        {
            logger.warn("Checkpoint {} belongs to {} -> {}, ignoring it", id, checkpoint.getUrl(), checkpoint.getDestination());
            deleteCheckpointQuietly();
            return false;
        }
        if(!Files.exists(partFile))
        {
            logger.info("Part file {} is gone, discarding checkpoint {}", partFile, id);
            deleteCheckpointQuietly();
            return false;
        }
        long size = checkpoint.getTotalSize();
        try
        {
            if(size != ResourceMetadata.UNKNOWN_SIZE && Files.size(partFile) != size)
            {
                logger.info("Part file {} does not match checkpoint {}, discarding it", partFile, id);
                deleteCheckpointQuietly();
                return false;
            }
        }
        catch(IOException e)
        {
            logger.warn("Cannot inspect part file {}: {}", partFile, e.getMessage());
            deleteCheckpointQuietly();
            return false;
        }

        List<Segment> restored = new ArrayList<>();
        try
        {
            List<SegmentRecord> records = checkpoint.getSegments();
            for(int i = 0; i < records.size(); i++)
            {
                restored.add(Segment.fromRecord(i, records.get(i)));
            }
        }
        catch(IllegalArgumentException e)
        {
            logger.warn("Checkpoint {} has an invalid segment ({}), discarding it", id, e.getMessage());
            deleteCheckpointQuietly();
            return false;
        }

        this.totalSize = size;
        this.validator = checkpoint.getValidator();
        this.mode = checkpoint.getMode();
        this.modeReason = checkpoint.getModeReason();
        this.concurrency = checkpoint.getConcurrency();
        this.metadata = null;
        this.restoredFromCheckpoint = true;
        this.segments = Collections.unmodifiableList(restored);
        progressTracker.reset(segments);
        logger.info("Restored download {} from checkpoint: {} of {} bytes in {} segments ({})",
            id, progressTracker.getTotalProgress(), size, restored.size(), mode);
        return true;
    }

    private void plan() throws DownloadException
    {
        ResourceMetadata probed = prober.probe(uri);
        List<Segment> planned;
        if(!probed.isSizeKnown())
        {
            mode = TransferMode.SINGLE_STREAM;
            modeReason = "resource size unknown";
            planned = SegmentPlanner.singleStream(ResourceMetadata.UNKNOWN_SIZE);
        }
        else if(!probed.supportsRanges())
        {
            mode = TransferMode.SINGLE_STREAM;
            modeReason = "server does not accept byte ranges";
            planned = SegmentPlanner.singleStream(probed.getTotalSize());
        }
        else
        {
            mode = TransferMode.SEGMENTED;
            modeReason = null;
            planned = SegmentPlanner.plan(probed.getTotalSize(), config.getMaxConnections(), config.getMinSegmentSize());
        }

        this.metadata = probed;
        this.totalSize = probed.getTotalSize();
        this.validator = probed.getValidator();
        this.concurrency = mode == TransferMode.SEGMENTED ? planned.size() : 1;
        this.restoredFromCheckpoint = false;

        closeChannelQuietly();
        try
        {
            Files.deleteIfExists(partFile);
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Cannot replace stale part file " + partFile, e);
        }
        this.segments = planned;
        progressTracker.reset(planned);
        openPartFile();
        persistCheckpoint(DownloadState.ACTIVE);

        if(mode == TransferMode.SEGMENTED)
        {
            logger.info("Planned download {}: {} bytes in {} segments", id, totalSize, planned.size());
        }
        else
        {
            logger.info("Planned download {} as a single stream ({})", id, modeReason);
        }
    }

    private void demote(DownloadException cause) throws DownloadException
    {
        logger.warn("Download {}: {}; falling back to a single stream", id, cause.getMessage());
        mode = TransferMode.SINGLE_STREAM;
        modeReason = cause.getMessage();
        concurrency = 1;
        segments = SegmentPlanner.singleStream(totalSize);
        progressTracker.reset(segments);
        persistCheckpoint(DownloadState.ACTIVE);
    }

    private void restartPlan(DownloadException cause) throws DownloadException
    {
        planRestarts++;
        if(planRestarts > config.getMaxPlanRestarts())
        {
            throw new DownloadException(FailureKind.VALIDATOR_MISMATCH,
                "Resource kept changing during the transfer: " + cause.getMessage(), cause);
        }
        logger.warn("Download {}: {}; discarding progress and planning again", id, cause.getMessage());
        closeChannelQuietly();
        deleteQuietly(partFile);
        deleteCheckpointQuietly();
        segments = Collections.emptyList();
        totalSize = ResourceMetadata.UNKNOWN_SIZE;
        validator = null;
        metadata = null;
        restoredFromCheckpoint = false;
        progressTracker.reset(segments);
    }

    // ==================== FETCHING ====================

    private Round runRound(StopSignal signal) throws DownloadException
    {
        openPartFile();
        List<Segment> plan = segments;
        int workers = Math.max(1, Math.min(concurrency, plan.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory("segment"));
        CompletionService<SegmentResult> completionService = new ExecutorCompletionService<>(pool);

        int submitted = 0;
        for(Segment segment : plan)
        {
            if(segment.getState() == SegmentState.DONE) continue;
            segment.markPending();
            segment.resetAttempts();
            completionService.submit(new SegmentFetcher(id, uri, segment, mode, totalSize, validator, channel,
                config, connection, retryPolicy, signal, progressTracker));
            submitted++;
        }
        logger.debug("Download {} dispatched {} of {} segments on {} workers", id, submitted, plan.size(), workers);

        Map<Integer, String> failures = new TreeMap<>();
        DownloadException abort = null;
        DownloadException changed = null;
        DownloadException rangesRejected = null;
        DownloadException exhausted = null;
        boolean clean = false;
        try
        {
            int finished = 0;
            while(finished < submitted)
            {
                Future<SegmentResult> future = completionService.poll(config.getCheckpointIntervalMS(), TimeUnit.MILLISECONDS);
                if(future == null)
                {
                    persistCheckpoint(DownloadState.ACTIVE);
                    continue;
                }
                finished++;

                SegmentResult segmentResult = resultOf(future);
                Segment segment = plan.get(segmentResult.getSegmentIndex());
                if(segmentResult.isSuccessful())
                {
                    segment.markDone();
                    progressTracker.report(segment, true);
                    persistCheckpoint(DownloadState.ACTIVE);
                    logger.debug("Segment {} of download {} done ({} bytes)", segment.getIndex(), id, segment.getWritten());
                    continue;
                }
                if(segmentResult.isStopped())
                {
                    segment.markPending();
                    continue;
                }

                DownloadException error = segmentResult.getError();
                failures.put(segment.getIndex(), segment.getFailureReason());
                FailureKind kind = error.getKind();
                if(kind.abortsTransfer())
                {
                    if(abort == null) abort = error;
                    signal.trip();
                }
                else if(kind.isRetryable())
                {
                    // the other segments keep going; the failed one is retried on resume
                    exhausted = error;
                    persistCheckpoint(DownloadState.ACTIVE);
                }
                else if(kind == FailureKind.VALIDATOR_MISMATCH)
                {
                    if(changed == null) changed = error;
                    signal.trip();
                }
                else if(kind == FailureKind.RANGE_UNSUPPORTED)
                {
                    if(rangesRejected == null) rangesRejected = error;
                    signal.trip();
                }
                else
                {
                    // a stopped segment reports a stop, never a failure
                    throw new IllegalStateException("Segment " + segment.getIndex() + " failed with " + kind);
                }
            }
            clean = true;
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new DownloadException(FailureKind.FATAL, "Interrupted while waiting for segments", e);
        }
        finally
        {
            if(!clean) signal.trip();
            awaitWorkers(pool);
        }

        if(request != null) return Round.stopped();
        if(abort != null) return Round.of(Round.Action.FAIL, abort, failures);
        if(changed != null) return Round.of(Round.Action.REPLAN, changed, failures);
        if(rangesRejected != null)
        {
            // nothing left to fall back to
            if(mode == TransferMode.SINGLE_STREAM) return Round.of(Round.Action.FAIL, rangesRejected, failures);
            return Round.of(Round.Action.DEMOTE, rangesRejected, failures);
        }
        if(exhausted != null)
        {
            DownloadException aggregate = new DownloadException(FailureKind.CONNECTION_TRANSIENT,
                failures.size() + " segment(s) exhausted their retries; last error: " + exhausted.getMessage(), exhausted);
            return Round.of(Round.Action.FAIL, aggregate, failures);
        }
        for(Segment segment : plan)
        {
            if(segment.getState() != SegmentState.DONE) return Round.stopped();
        }
        return Round.complete();
    }

    private SegmentResult resultOf(Future<SegmentResult> future) throws InterruptedException
    {
        try
        {
            return future.get();
        }
        catch(ExecutionException e)
        {
            // SegmentFetcher reports failures as results; this is a bug in a task
            logger.error("Segment task of download {} threw", id, e.getCause());
            throw new IllegalStateException("Segment task failed unexpectedly", e.getCause());
        }
    }

    private void awaitWorkers(ExecutorService pool)
    {
        // shutdownNow would interrupt writers, which closes the shared channel
        pool.shutdown();
        try
        {
            while(!pool.awaitTermination(1, TimeUnit.SECONDS))
            {
                logger.debug("Waiting for segment tasks of download {} to stop", id);
            }
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== FINALIZING ====================

    private DownloadResult complete() throws DownloadException
    {
        closeChannel();
        long finalSize = TransferFinalizer.finalizeTransfer(segments, totalSize, partFile, destinationPath);
        deleteCheckpointQuietly();
        logger.info("Download {} completed: {} ({} bytes)", id, destination, finalSize);
        return DownloadResult.completed(id, destination, finalSize);
    }

    private DownloadResult fail(DownloadException cause, Map<Integer, String> failures)
    {
        DownloadException error = cause.withContext(id, url);
        logger.error("Download {} failed ({}): {}", id, error.getKind(), error.getMessage());
        if(error.isResumable() && !segments.isEmpty())
        {
            try
            {
                persistCheckpoint(DownloadState.FAILED);
            }
            catch(DownloadException e)
            {
                logger.warn("Could not save checkpoint for failed download {}: {}", id, e.getMessage());
            }
            closeChannelQuietly();
        }
        else
        {
            closeChannelQuietly();
            deleteQuietly(partFile);
            deleteCheckpointQuietly();
        }
        return DownloadResult.failed(id, destination, error, failures);
    }

    // ==================== FILES ====================

    /**
     * Opens the part file for positional writes, creating and presizing it when missing.
     */
    private void openPartFile() throws DownloadException
    {
        if(channel != null && channel.isOpen()) return;
        try
        {
            if(!Files.exists(partFile))
            {
                for(Segment segment : segments)
                {
                    if(segment.getWritten() > 0)
                    {
                        logger.warn("Part file {} disappeared, download {} starts over", partFile, id);
                        resetProgress();
                        break;
                    }
                }
                Path parent = partFile.getParent();
                if(parent != null) Files.createDirectories(parent);
                try(RandomAccessFile file = new RandomAccessFile(partFile.toFile(), "rw"))
                {
                    if(totalSize > 0) file.setLength(totalSize);
                }
            }
            channel = FileChannel.open(partFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Cannot open part file " + partFile + ": " + e.getMessage(), e);
        }
    }

    private void resetProgress()
    {
        for(Segment segment : segments)
        {
            if(segment.getWritten() == 0) continue;
            segment.resetProgress();
            segment.markPending();
        }
        progressTracker.reset(segments);
    }

    /**
     * Forces written bytes to disk, then saves the plan. Progress is read before the
     * force so the checkpoint never claims bytes that were not flushed.
     */
    private void persistCheckpoint(DownloadState checkpointState) throws DownloadException
    {
        List<Segment> plan = segments;
        if(plan.isEmpty()) return;
        List<SegmentRecord> records = new ArrayList<>(plan.size());
        for(Segment segment : plan)
        {
            records.add(segment.toRecord());
        }
        try
        {
            if(channel != null && channel.isOpen()) channel.force(false);
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Flushing " + partFile + " failed: " + e.getMessage(), e);
        }

        Checkpoint checkpoint = new Checkpoint(id, url, destination, totalSize, validator, mode, modeReason,
            concurrency, checkpointState, records);
        try
        {
            checkpointStore.save(checkpoint);
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Saving checkpoint for " + id + " failed: " + e.getMessage(), e);
        }
    }

    private void closeChannel() throws DownloadException
    {
        if(channel == null) return;
        try
        {
            if(channel.isOpen())
            {
                channel.force(true);
                channel.close();
            }
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Closing " + partFile + " failed: " + e.getMessage(), e);
        }
        finally
        {
            channel = null;
        }
    }

    private void closeChannelQuietly()
    {
        try
        {
            closeChannel();
        }
        catch(DownloadException e)
        {
            logger.warn("Download {}: {}", id, e.getMessage());
        }
    }

    private void deleteQuietly(Path file)
    {
        try
        {
            Files.deleteIfExists(file);
        }
        catch(IOException e)
        {
            logger.warn("Failed to delete {}: {}", file, e.getMessage());
        }
    }

    private void deleteCheckpointQuietly()
    {
        try
        {
            checkpointStore.delete(id);
        }
        catch(IOException e)
        {
            logger.warn("Failed to delete checkpoint {}: {}", id, e.getMessage());
        }
    }

    private ThreadFactory threadFactory(String role)
    {
        AtomicInteger counter = new AtomicInteger();
        String prefix = role + "-" + id.substring(0, 8) + "-";
        return runnable ->
        {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ==================== GETTERS ====================

    public String getId()
    {
        return id;
    }

    public String getUrl()
    {
        return url;
    }

    public String getDestination()
    {
        return destination;
    }

    public Path getPartFile()
    {
        return partFile;
    }

    public DownloadState getState()
    {
        return state;
    }

    public boolean isStarted()
    {
        return started;
    }

    public long getTotalSize()
    {
        return totalSize;
    }

    public TransferMode getMode()
    {
        return mode;
    }

    public String getModeReason()
    {
        return modeReason;
    }

    public int getConcurrency()
    {
        return concurrency;
    }

    public Validator getValidator()
    {
        return validator;
    }

    // null when the plan was restored from a checkpoint instead of probed
    public ResourceMetadata getMetadata()
    {
        return metadata;
    }

    public boolean isRestoredFromCheckpoint()
    {
        return restoredFromCheckpoint;
    }

    // snapshot copies; mutating them does not affect the transfer
    public List<Segment> getSegments()
    {
        List<Segment> copies = new ArrayList<>();
        for(Segment segment : segments)
        {
            copies.add(segment.copy());
        }
        return copies;
    }

    public long getDownloadedBytes()
    {
        return progressTracker.getTotalProgress();
    }

    public double getProgress()
    {
        return progressTracker.getProgressPercentage(totalSize);
    }

    public double getBytesPerSecond()
    {
        return progressTracker.getBytesPerSecond();
    }

    // null until the transfer is terminal
    public DownloadResult getResult()
    {
        return result;
    }

    private static final class Round
    {
        private enum Action
        {
            COMPLETE,
            STOPPED,
            DEMOTE,
            REPLAN,
            FAIL
        }

        private final Action action;
        private final DownloadException error;
        private final Map<Integer, String> failures;

        private Round(Action action, DownloadException error, Map<Integer, String> failures)
        {
            this.action = action;
            this.error = error;
            this.failures = failures;
        }

        private static Round complete()
        {
            return new Round(Action.COMPLETE, null, Collections.emptyMap());
        }

        private static Round stopped()
        {
            return new Round(Action.STOPPED, null, Collections.emptyMap());
        }

        private static Round of(Action action, DownloadException error, Map<Integer, String> failures)
        {
            return new Round(action, error, failures);
        }
    }
}
