import io.rileyhe1.segmented.Data.Checkpoint;
import io.rileyhe1.segmented.Data.DownloadState;
import io.rileyhe1.segmented.Data.SegmentRecord;
import io.rileyhe1.segmented.Data.SegmentState;
import io.rileyhe1.segmented.Data.TransferMode;
import io.rileyhe1.segmented.Data.Validator;
import io.rileyhe1.segmented.Store.JsonCheckpointStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for JsonCheckpointStore class.
 * Tests persistence, corrupt and expired checkpoints, and structural verification.
 */
class JsonCheckpointStoreTest
{
    private static final String ID = "0f3b7c2e-1d4a-3b5c-9e8f-123456789abc";
    private static final long WEEK_MS = 7L * 24 * 60 * 60 * 1000;

    @TempDir
    Path tempDir;

    private JsonCheckpointStore store;

    @BeforeEach
    void setUp() throws IOException
    {
        store = new JsonCheckpointStore(tempDir.resolve("checkpoints").toString(), WEEK_MS);
    }

    private static Checkpoint checkpoint(String id, List<SegmentRecord> segments, long totalSize)
    {
        return new Checkpoint(id, "https://example.com/file.bin", "/downloads/file.bin", totalSize,
            Validator.etag("\"v1\""), TransferMode.SEGMENTED, null, segments.size(), DownloadState.ACTIVE, segments);
    }

    private static List<SegmentRecord> fourSegments()
    {
        return Arrays.asList(
            new SegmentRecord(0, 250, 250, SegmentState.DONE, 1),
            new SegmentRecord(250, 500, 120, SegmentState.ACTIVE, 2),
            new SegmentRecord(500, 750, 0, SegmentState.PENDING, 0),
            new SegmentRecord(750, 1000, 30, SegmentState.FAILED, 5));
    }

    // ============================================================
    // SAVE / LOAD TESTS
    // ============================================================

    @Test
    void testConstructorCreatesDirectory()
    {
        assertTrue(Files.isDirectory(tempDir.resolve("checkpoints")));
        assertEquals(tempDir.resolve("checkpoints"), store.getDirectory());
    }

    @Test
    void testSaveAndLoadPreservesPlanAndProgress() throws IOException
    {
        store.save(checkpoint(ID, fourSegments(), 1000));

        Optional<Checkpoint> loaded = store.load(ID);

        assertTrue(loaded.isPresent());
        Checkpoint checkpoint = loaded.get();
        assertEquals(ID, checkpoint.getId());
        assertEquals(1000, checkpoint.getTotalSize());
        assertEquals(Validator.etag("\"v1\""), checkpoint.getValidator());
        assertEquals(TransferMode.SEGMENTED, checkpoint.getMode());
        assertEquals(4, checkpoint.getSegments().size());
        assertEquals(120, checkpoint.getSegments().get(1).getWritten());
        assertEquals(SegmentState.DONE, checkpoint.getSegments().get(0).getState());
        assertEquals(5, checkpoint.getSegments().get(3).getAttempts());
    }

    @Test
    void testSaveReplacesPreviousCheckpoint() throws IOException
    {
        store.save(checkpoint(ID, fourSegments(), 1000));
        List<SegmentRecord> progressed = Arrays.asList(
            new SegmentRecord(0, 250, 250, SegmentState.DONE, 1),
            new SegmentRecord(250, 500, 250, SegmentState.DONE, 2),
            new SegmentRecord(500, 750, 90, SegmentState.PENDING, 1),
            new SegmentRecord(750, 1000, 30, SegmentState.PENDING, 5));
        store.save(checkpoint(ID, progressed, 1000));

        Checkpoint loaded = store.load(ID).orElseThrow();
        assertEquals(SegmentState.DONE, loaded.getSegments().get(1).getState());
        assertEquals(90, loaded.getSegments().get(2).getWritten());
        assertFalse(Files.exists(store.getDirectory().resolve(ID + ".json.tmp")));
    }

    @Test
    void testLoadMissingCheckpointIsEmpty()
    {
        assertFalse(store.load(ID).isPresent());
    }

    @Test
    void testDelete() throws IOException
    {
        store.save(checkpoint(ID, fourSegments(), 1000));
        store.delete(ID);

        assertFalse(store.load(ID).isPresent());
        // deleting twice is fine
        store.delete(ID);
    }

    @Test
    void testLoadAll() throws IOException
    {
        String otherId = "1a2b3c4d-0000-3000-8000-000000000001";
        store.save(checkpoint(ID, fourSegments(), 1000));
        store.save(checkpoint(otherId, Collections.singletonList(new SegmentRecord(0, 10, 4, SegmentState.PENDING, 0)), 10));

        assertEquals(2, store.loadAll().size());
    }

    @Test
    void testUnknownSizeCheckpoint() throws IOException
    {
        Checkpoint unknown = new Checkpoint(ID, "https://example.com/stream", "/downloads/stream", -1,
            null, TransferMode.SINGLE_STREAM, "resource size unknown", 1, DownloadState.PAUSED,
            Collections.singletonList(new SegmentRecord(0, -1, 300, SegmentState.PENDING, 1)));
        store.save(unknown);

        Checkpoint loaded = store.load(ID).orElseThrow();
        assertEquals(-1, loaded.getTotalSize());
        assertNull(loaded.getValidator());
        assertEquals("resource size unknown", loaded.getModeReason());
    }

    // ============================================================
    // CORRUPT / EXPIRED TESTS
    // ============================================================

    @Test
    void testUnparseableCheckpointIsAbsentAndSetAside() throws IOException
    {
        Path file = store.getDirectory().resolve(ID + ".json");
        Files.write(file, "{ this is not json".getBytes(StandardCharsets.UTF_8));

        assertFalse(store.load(ID).isPresent());
        assertFalse(Files.exists(file));
        assertTrue(Files.exists(store.getDirectory().resolve(ID + ".json.corrupt")));
    }

    @Test
    void testCheckpointWithGapIsAbsent() throws IOException
    {
        List<SegmentRecord> gap = Arrays.asList(
            new SegmentRecord(0, 250, 0, SegmentState.PENDING, 0),
            new SegmentRecord(300, 1000, 0, SegmentState.PENDING, 0));
        store.save(checkpoint(ID, gap, 1000));

        assertFalse(store.load(ID).isPresent());
    }

    @Test
    void testCheckpointNotCoveringSizeIsAbsent() throws IOException
    {
        List<SegmentRecord> short_ = Collections.singletonList(new SegmentRecord(0, 900, 0, SegmentState.PENDING, 0));
        store.save(checkpoint(ID, short_, 1000));

        assertFalse(store.load(ID).isPresent());
    }

    @Test
    void testDoneSegmentThatIsIncompleteIsAbsent() throws IOException
    {
        List<SegmentRecord> lying = Arrays.asList(
            new SegmentRecord(0, 500, 499, SegmentState.DONE, 1),
            new SegmentRecord(500, 1000, 0, SegmentState.PENDING, 0));
        store.save(checkpoint(ID, lying, 1000));

        assertFalse(store.load(ID).isPresent());
    }

    @Test
    void testProgressBeyondSegmentIsAbsent() throws IOException
    {
        List<SegmentRecord> overflow = Collections.singletonList(new SegmentRecord(0, 1000, 1001, SegmentState.PENDING, 0));
        store.save(checkpoint(ID, overflow, 1000));

        assertFalse(store.load(ID).isPresent());
    }

    @Test
    void testFileNameMustMatchId() throws IOException
    {
        store.save(checkpoint(ID, fourSegments(), 1000));
        Path renamed = store.getDirectory().resolve("2b2b2b2b-0000-3000-8000-000000000002.json");
        Files.move(store.getDirectory().resolve(ID + ".json"), renamed);

        assertFalse(store.load("2b2b2b2b-0000-3000-8000-000000000002").isPresent());
    }

    @Test
    void testExpiredCheckpointIsAbsent() throws IOException, InterruptedException
    {
        JsonCheckpointStore shortLived = new JsonCheckpointStore(tempDir.resolve("short").toString(), 50);
        shortLived.save(checkpoint(ID, fourSegments(), 1000));
        Thread.sleep(150);

        assertFalse(shortLived.load(ID).isPresent());
        assertFalse(Files.exists(shortLived.getDirectory().resolve(ID + ".json")));
    }

    // ============================================================
    // VALIDATION TESTS
    // ============================================================

    @Test
    void testInvalidIdsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> store.load("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.load(""));
        assertThrows(IllegalArgumentException.class, () -> store.save(null));
    }

    @Test
    void testInvalidConstructorArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> new JsonCheckpointStore(" ", WEEK_MS));
        assertThrows(IllegalArgumentException.class, () -> new JsonCheckpointStore(tempDir.toString(), 0));
    }
}
