package io.rileyhe1.segmented.Util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Segment;
import io.rileyhe1.segmented.Data.SegmentResult;
import io.rileyhe1.segmented.Data.TransferMode;
import io.rileyhe1.segmented.Data.Validator;
import io.rileyhe1.segmented.Net.RangeConnection;
import io.rileyhe1.segmented.Net.RangeRequest;
import io.rileyhe1.segmented.Net.RangeResponse;

/**
 * Fetches one segment into the shared part file, retrying transient failures with backoff.
 * Bytes land at their absolute offset, so segments never touch each other's ranges.
 */
public class SegmentFetcher implements Callable<SegmentResult>
{
    private static final Logger logger = LoggerFactory.getLogger(SegmentFetcher.class);

    // Configuration
    private final String transferId;
    private final URI uri;
    private final Segment segment;
    private final TransferMode mode;
    private final long totalSize;
    private final Validator validator;
    private final FileChannel channel;
    private final DownloadConfig config;
    private final RangeConnection connection;
    private final RetryPolicy retryPolicy;
    private final StopSignal stopSignal;
    private final ProgressTracker progressTracker;

    public SegmentFetcher(String transferId, URI uri, Segment segment, TransferMode mode, long totalSize,
                          Validator validator, FileChannel channel, DownloadConfig config, RangeConnection connection,
                          RetryPolicy retryPolicy, StopSignal stopSignal, ProgressTracker progressTracker)
    {
        if(transferId == null || transferId.isEmpty()) throw new IllegalArgumentException("Transfer id cannot be null or empty");
        if(uri == null) throw new IllegalArgumentException("URI cannot be null");
        if(segment == null) throw new IllegalArgumentException("Segment cannot be null");
        if(mode == null) throw new IllegalArgumentException("Mode cannot be null");
        if(channel == null) throw new IllegalArgumentException("Channel cannot be null");
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        if(connection == null) throw new IllegalArgumentException("Connection cannot be null");
        if(retryPolicy == null) throw new IllegalArgumentException("Retry policy cannot be null");
        if(stopSignal == null) throw new IllegalArgumentException("Stop signal cannot be null");
        if(progressTracker == null) throw new IllegalArgumentException("Progress tracker cannot be null");
        if(mode == TransferMode.SEGMENTED && !segment.isBounded())
        {
            throw new IllegalArgumentException("A segmented transfer cannot have an unbounded segment");
        }

        this.transferId = transferId;
        this.uri = uri;
        this.segment = segment;
        this.mode = mode;
        this.totalSize = totalSize;
        this.validator = validator;
        this.channel = channel;
        this.config = config;
        this.connection = connection;
        this.retryPolicy = retryPolicy;
        this.stopSignal = stopSignal;
        this.progressTracker = progressTracker;
    }

    @Override
    public SegmentResult call()
    {
        int attempt = 0;
        while(true)
        {
            if(stopSignal.isTripped()) return stopped();

            attempt++;
            segment.incrementAttempts();
            segment.markActive();
            discardUnresumableProgress();
            progressTracker.markAttemptStart(segment.getIndex(), segment.getWritten());
            progressTracker.report(segment, true);

            DownloadException failure;
            try
            {
                if(fetchOnce())
                {
                    return SegmentResult.success(segment.getIndex(), segment.getWritten());
                }
                return stopped();
            }
            catch(DownloadException e)
            {
                failure = e;
            }

            // a connection we closed ourselves looks like a reset; it is not a failure
            if(stopSignal.isTripped()) return stopped();

            FailureKind kind = failure.getKind();
            segment.markFailed(kind, failure.getMessage());
            progressTracker.report(segment, true);
            if(!retryPolicy.shouldRetry(kind, attempt))
            {
                if(kind.isRetryable())
                {
                    logger.warn("Segment {} of {} gave up after {} attempts: {}", segment.getIndex(), transferId, attempt, failure.getMessage());
                }
                else
                {
                    logger.warn("Segment {} of {} failed with {}: {}", segment.getIndex(), transferId, kind, failure.getMessage());
                }
                return SegmentResult.failure(segment.getIndex(), segment.getWritten(), failure);
            }

            long delay = retryPolicy.backoffDelay(attempt);
            logger.debug("Segment {} attempt {} failed ({}), retrying in {} ms", segment.getIndex(), attempt, failure.getMessage(), delay);
            try
            {
                if(stopSignal.await(delay)) return stopped();
            }
            catch(InterruptedException e)
            {
                Thread.currentThread().interrupt();
                return stopped();
            }
        }
    }

    // a full-body request always starts over at byte 0
    private void discardUnresumableProgress()
    {
        boolean ranged = mode == TransferMode.SEGMENTED;
        if((!ranged || !config.isResumePartialSegments()) && segment.getWritten() > 0)
        {
            segment.resetProgress();
            progressTracker.setProgress(segment.getIndex(), 0);
        }
    }

    /**
     * One request for the rest of the segment.
     *
     * @return true once the segment is complete, false if a stop was requested mid-stream
     */
    private boolean fetchOnce() throws DownloadException
    {
        boolean ranged = mode == TransferMode.SEGMENTED;
        if(segment.isBounded() && segment.remaining() == 0)
        {
            return true;
        }

        RangeRequest request = ranged
            ? RangeRequest.range(uri, segment.nextOffset(), segment.getEnd(), validator)
            : RangeRequest.fullBody(uri, validator);

        RangeResponse response;
        try
        {
            response = connection.fetch(request);
        }
        catch(IOException e)
        {
            throw retryPolicy.toDownloadException(e, "Request " + request + " failed");
        }

        stopSignal.register(response);
        try
        {
            verifyResponse(request, response);
            return stream(response);
        }
        finally
        {
            stopSignal.unregister(response);
            try
            {
                response.close();
            }
            catch(IOException e)
            {
                logger.debug("Closing response for segment {} failed: {}", segment.getIndex(), e.getMessage());
            }
        }
    }

    private void verifyResponse(RangeRequest request, RangeResponse response) throws DownloadException
    {
        Validator current = response.getValidator();
        if(validator != null && current != null && validator.getType() == current.getType() && !validator.equals(current))
        {
            throw new DownloadException(FailureKind.VALIDATOR_MISMATCH,
                "Resource changed: expected " + validator + " but server sent " + current);
        }

        if(request.isRanged())
        {
            if(!response.isPartial())
            {
                throw new DownloadException(FailureKind.RANGE_UNSUPPORTED,
                    "Server answered " + response.getStatusCode() + " to a range request for segment " + segment.getIndex());
            }
            if(response.getRangeStart() != RangeResponse.UNKNOWN && response.getRangeStart() != request.getStart())
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                    "Requested bytes from " + request.getStart() + " but server sent from " + response.getRangeStart());
            }
            if(response.getInstanceLength() != RangeResponse.UNKNOWN && totalSize != ResourceMetadata.UNKNOWN_SIZE
                && response.getInstanceLength() != totalSize)
            {
                throw new DownloadException(FailureKind.VALIDATOR_MISMATCH,
                    "Resource size changed from " + totalSize + " to " + response.getInstanceLength());
            }
            long expected = request.getEnd() - request.getStart();
            if(response.getContentLength() != RangeResponse.UNKNOWN && response.getContentLength() != expected)
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                    "Requested " + expected + " bytes but server announced " + response.getContentLength());
            }
        }
        else
        {
            if(response.isPartial())
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION, "Server sent a partial response to a full request");
            }
            if(totalSize != ResourceMetadata.UNKNOWN_SIZE && response.getContentLength() != RangeResponse.UNKNOWN
                && response.getContentLength() != totalSize)
            {
                throw new DownloadException(FailureKind.VALIDATOR_MISMATCH,
                    "Resource size changed from " + totalSize + " to " + response.getContentLength());
            }
        }
    }

    private boolean stream(RangeResponse response) throws DownloadException
    {
        byte[] buffer = new byte[config.getBufferSize()];
        InputStream in = response.getBody();
        while(true)
        {
            int bytesRead;
            try
            {
                bytesRead = in.read(buffer);
            }
            catch(IOException e)
            {
                if(stopSignal.isTripped()) return false;
                throw retryPolicy.toDownloadException(e, "Reading segment " + segment.getIndex() + " failed after "
                    + segment.getWritten() + " bytes");
            }
            if(bytesRead == -1) break;
            if(stopSignal.isTripped()) return false;

            if(segment.isBounded() && segment.getWritten() + bytesRead > segment.length())
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                    "Server sent more than the " + segment.length() + " bytes of segment " + segment.getIndex());
            }
            write(buffer, bytesRead, segment.nextOffset());
            segment.addWritten(bytesRead);
            progressTracker.updateProgress(segment.getIndex(), bytesRead);
            progressTracker.report(segment, false);
        }

        if(segment.isBounded() && !segment.isFullyWritten())
        {
            throw new DownloadException(FailureKind.CONNECTION_TRANSIENT,
                "Connection closed after " + segment.getWritten() + " of " + segment.length() + " bytes of segment " + segment.getIndex());
        }
        return true;
    }

    private void write(byte[] buffer, int length, long position) throws DownloadException
    {
        ByteBuffer source = ByteBuffer.wrap(buffer, 0, length);
        long offset = position;
        try
        {
            while(source.hasRemaining())
            {
                offset += channel.write(source, offset);
            }
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Writing segment " + segment.getIndex() + " at offset " + offset + " failed", e);
        }
    }

    private SegmentResult stopped()
    {
        return SegmentResult.stopped(segment.getIndex(), segment.getWritten());
    }
}
