package io.rileyhe1.segmented.Store;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import io.rileyhe1.segmented.Data.Checkpoint;
import io.rileyhe1.segmented.Data.Segment;
import io.rileyhe1.segmented.Data.SegmentRecord;
import io.rileyhe1.segmented.Data.SegmentState;

/**
 * One pretty-printed JSON file per transfer, named after the transfer id.
 * Saves go through a temp file that is forced to disk and then atomically moved
 * over the previous checkpoint, so a crash leaves either the old or the new snapshot.
 */
public class JsonCheckpointStore implements CheckpointStore
{
    private static final Logger logger = LoggerFactory.getLogger(JsonCheckpointStore.class);

    private static final String EXTENSION = ".json";
    private static final String TEMP_EXTENSION = ".json.tmp";
    private static final String CORRUPT_EXTENSION = ".corrupt";

    private final Path directory;
    private final long maxAgeMS;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Object writeLock = new Object();

    public JsonCheckpointStore(String directory, long maxAgeMS) throws IOException
    {
        if(directory == null || directory.trim().isEmpty()) throw new IllegalArgumentException("Checkpoint directory cannot be null or empty");
        if(maxAgeMS < 1) throw new IllegalArgumentException("Max age must be positive");
        this.directory = Paths.get(directory);
        this.maxAgeMS = maxAgeMS;
        Files.createDirectories(this.directory);
    }

    public Path getDirectory()
    {
        return directory;
    }

    @Override
    public Optional<Checkpoint> load(String transferId)
    {
        Path file = fileFor(transferId);
        if(!Files.exists(file)) return Optional.empty();
        return read(file, transferId);
    }

    @Override
    public List<Checkpoint> loadAll()
    {
        List<Checkpoint> checkpoints = new ArrayList<>();
        try(DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION))
        {
            for(Path file : files)
            {
                String name = file.getFileName().toString();
                String transferId = name.substring(0, name.length() - EXTENSION.length());
                read(file, transferId).ifPresent(checkpoints::add);
            }
        }
        catch(IOException e)
        {
            logger.warn("Failed to list checkpoints in {}: {}", directory, e.getMessage());
        }
        return checkpoints;
    }

    private Optional<Checkpoint> read(Path file, String transferId)
    {
        Checkpoint checkpoint;
        try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            checkpoint = gson.fromJson(reader, Checkpoint.class);
        }
        catch(IOException | JsonParseException e)
        {
            quarantine(file, "unreadable: " + e.getMessage());
            return Optional.empty();
        }

        String problem = verify(checkpoint, transferId);
        if(problem != null)
        {
            quarantine(file, problem);
            return Optional.empty();
        }

        long age = System.currentTimeMillis() - checkpoint.getUpdatedAt();
        if(age > maxAgeMS)
        {
            logger.info("Checkpoint {} expired ({} ms old), discarding", transferId, age);
            deleteQuietly(file);
            return Optional.empty();
        }
        return Optional.of(checkpoint);
    }

    @Override
    public void save(Checkpoint checkpoint) throws IOException
    {
        if(checkpoint == null) throw new IllegalArgumentException("Checkpoint cannot be null");
        Path target = fileFor(checkpoint.getId());
        Path temp = directory.resolve(checkpoint.getId() + TEMP_EXTENSION);

        synchronized(writeLock)
        {
            checkpoint.setUpdatedAt(System.currentTimeMillis());
            try(Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8))
            {
                gson.toJson(checkpoint, writer);
            }
            try(FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE))
            {
                channel.force(true);
            }
            try
            {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch(AtomicMoveNotSupportedException e)
            {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        logger.debug("Saved checkpoint {} ({} segments, state {})", checkpoint.getId(), checkpoint.getSegments().size(), checkpoint.getState());
    }

    @Override
    public void delete(String transferId) throws IOException
    {
        Path file = fileFor(transferId);
        synchronized(writeLock)
        {
            Files.deleteIfExists(file);
            Files.deleteIfExists(directory.resolve(transferId + TEMP_EXTENSION));
        }
        logger.debug("Deleted checkpoint {}", transferId);
    }

    private Path fileFor(String transferId)
    {
        if(transferId == null || transferId.trim().isEmpty()) throw new IllegalArgumentException("Transfer id cannot be null or empty");
        if(!transferId.matches("[A-Za-z0-9._-]+") || transferId.startsWith("."))
        {
            throw new IllegalArgumentException("Invalid transfer id: " + transferId);
        }
        return directory.resolve(transferId + EXTENSION);
    }

    private void quarantine(Path file, String problem)
    {
        logger.warn("Checkpoint {} is corrupt ({}), treating it as absent", file.getFileName(), problem);
        try
        {
            Files.move(file, file.resolveSibling(file.getFileName() + CORRUPT_EXTENSION), StandardCopyOption.REPLACE_EXISTING);
        }
        catch(IOException e)
        {
            logger.warn("Failed to set aside corrupt checkpoint {}: {}", file, e.getMessage());
            deleteQuietly(file);
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
            // Log but don't fail - a stale file is only re-checked next load
            logger.warn("Failed to delete checkpoint file {}: {}", file, e.getMessage());
        }
    }

    /**
     * Structural check of a deserialized checkpoint.
     *
     * @return a description of the first problem found, or null if the checkpoint is usable
     */
    static String verify(Checkpoint checkpoint, String expectedId)
    {
        if(checkpoint == null) return "empty document";
        if(checkpoint.getFormatVersion() != Checkpoint.FORMAT_VERSION) return "unsupported format version " + checkpoint.getFormatVersion();
        if(checkpoint.getId() == null || !checkpoint.getId().equals(expectedId)) return "id does not match file name";
        if(checkpoint.getUrl() == null || checkpoint.getDestination() == null) return "missing url or destination";
        if(checkpoint.getMode() == null) return "missing transfer mode";
        if(checkpoint.getConcurrency() < 1) return "invalid concurrency " + checkpoint.getConcurrency();

        List<SegmentRecord> segments = checkpoint.getSegments();
        if(segments == null || segments.isEmpty()) return "no segments";

        long total = checkpoint.getTotalSize();
        if(total < 0)
        {
            if(segments.size() != 1 || segments.get(0).getStart() != 0 || segments.get(0).getEnd() != Segment.UNBOUNDED)
            {
                return "unknown size requires a single unbounded segment";
            }
            return segments.get(0).getWritten() < 0 ? "negative progress" : null;
        }

        long expectedStart = 0;
        for(int i = 0; i < segments.size(); i++)
        {
            SegmentRecord record = segments.get(i);
            if(record == null) return "null segment " + i;
            if(record.getStart() != expectedStart) return "segment " + i + " does not start at " + expectedStart;
            if(record.getEnd() < record.getStart()) return "segment " + i + " ends before it starts";
            long length = record.getEnd() - record.getStart();
            if(record.getWritten() < 0 || record.getWritten() > length) return "segment " + i + " progress out of range";
            if(record.getState() == SegmentState.DONE && record.getWritten() != length) return "segment " + i + " done but incomplete";
            expectedStart = record.getEnd();
        }
        if(expectedStart != total) return "segments cover " + expectedStart + " of " + total + " bytes";
        return null;
    }
}
