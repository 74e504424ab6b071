package io.rileyhe1.segmented.Util;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Segment;
import io.rileyhe1.segmented.Data.SegmentState;

/**
 * Checks that a plan is fully written and moves the part file onto the destination.
 * The destination only ever appears complete.
 */
public final class TransferFinalizer
{
    private static final Logger logger = LoggerFactory.getLogger(TransferFinalizer.class);

    public static final String PART_SUFFIX = ".part";

    private TransferFinalizer()
    {
    }

    public static Path partFileFor(Path destination)
    {
        return destination.resolveSibling(destination.getFileName().toString() + PART_SUFFIX);
    }

    /**
     * @param totalSize planned size, or {@link ResourceMetadata#UNKNOWN_SIZE} to accept whatever was received
     * @return the final size of the destination
     */
    public static long finalizeTransfer(List<Segment> segments, long totalSize, Path partFile, Path destination)
        throws DownloadException
    {
        long expected = verifySegments(segments, totalSize);

        try
        {
            if(!Files.exists(partFile))
            {
                // empty resources never needed a part file
                if(expected != 0) throw new DownloadException(FailureKind.DISK_IO, "Part file " + partFile + " is missing");
                Files.createFile(partFile);
            }
            long actual = Files.size(partFile);
            if(actual != expected)
            {
                if(actual < expected)
                {
                    throw new DownloadException(FailureKind.DISK_IO,
                        "Part file " + partFile + " holds " + actual + " bytes, expected " + expected);
                }
                // a reused part file from an earlier, larger plan
                try(FileChannel channel = FileChannel.open(partFile, StandardOpenOption.WRITE))
                {
                    channel.truncate(expected);
                    channel.force(true);
                }
            }
            move(partFile, destination);
        }
        catch(IOException e)
        {
            throw new DownloadException(FailureKind.DISK_IO, "Finalizing " + destination + " failed: " + e.getMessage(), e);
        }
        logger.debug("Moved {} to {} ({} bytes)", partFile, destination, expected);
        return expected;
    }

    /**
     * @return the number of bytes the destination must hold
     */
    static long verifySegments(List<Segment> segments, long totalSize) throws DownloadException
    {
        if(segments == null || segments.isEmpty())
        {
            throw new DownloadException(FailureKind.PROTOCOL_VIOLATION, "Cannot finalize a transfer without segments");
        }
        long covered = 0;
        long written = 0;
        for(Segment segment : segments)
        {
            if(segment.getState() != SegmentState.DONE)
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                    "Segment " + segment.getIndex() + " is " + segment.getState() + ", not done");
            }
            if(segment.getStart() != covered)
            {
                throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                    "Segment " + segment.getIndex() + " starts at " + segment.getStart() + ", expected " + covered);
            }
            if(segment.isBounded())
            {
                if(!segment.isFullyWritten())
                {
                    throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                        "Segment " + segment.getIndex() + " holds " + segment.getWritten() + " of " + segment.length() + " bytes");
                }
                covered = segment.getEnd();
            }
            else
            {
                covered += segment.getWritten();
            }
            written += segment.getWritten();
        }

        if(totalSize != ResourceMetadata.UNKNOWN_SIZE && (covered != totalSize || written != totalSize))
        {
            throw new DownloadException(FailureKind.PROTOCOL_VIOLATION,
                "Segments hold " + written + " bytes, expected " + totalSize);
        }
        return written;
    }

    static void move(Path source, Path target) throws IOException
    {
        try
        {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch(AtomicMoveNotSupportedException e)
        {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
