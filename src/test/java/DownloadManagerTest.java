import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.DownloadOutcome;
import io.rileyhe1.segmented.Data.DownloadResult;
import io.rileyhe1.segmented.Data.DownloadState;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.Validator;
import io.rileyhe1.segmented.DownloadManager;
import io.rileyhe1.segmented.Net.HttpStatusException;
import io.rileyhe1.segmented.Store.JsonCheckpointStore;
import io.rileyhe1.segmented.Util.Download;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for DownloadManager class.
 * Tests download lifecycle by id, destination conflicts, persistence and shutdown.
 */
@Timeout(30)
class DownloadManagerTest
{
    private static final String URL = "https://example.com/files/report.bin";
    private static final String OTHER_URL = "https://example.com/files/other.bin";

    @TempDir
    Path tempDir;

    private byte[] content;
    private ScriptedConnection connection;
    private DownloadConfig config;
    private JsonCheckpointStore store;
    private DownloadManager manager;

    @BeforeEach
    void setUp() throws IOException
    {
        content = ScriptedConnection.pattern(1000, 13);
        connection = new ScriptedConnection(content, Validator.etag("\"m1\""));
        config = DownloadConfig.builder()
            .maxConnections(4)
            .minSegmentSize(100)
            .maxAttempts(3)
            .retryDelayMS(10)
            .maxRetryDelayMS(50)
            .checkpointIntervalMS(50)
            .checkpointDirectory(tempDir.resolve("checkpoints").toString())
            .build();
        store = new JsonCheckpointStore(config.getCheckpointDirectory(), config.getCheckpointMaxAgeMS());
        manager = new DownloadManager(config, connection, store);
    }

    @AfterEach
    void tearDown()
    {
        connection.openGate();
        if(manager != null)
        {
            manager.shutdown();
        }
    }

    private String dest(String name)
    {
        return tempDir.resolve(name).toString();
    }

    // holds every body at byte 600 and waits until the transfer has reached it
    private Download startHeld(String destination) throws InterruptedException
    {
        connection.setGate(600);
        Download download = manager.startDownload(URL, destination);
        long deadline = System.currentTimeMillis() + 10_000;
        while(download.getDownloadedBytes() < 600)
        {
            if(System.currentTimeMillis() > deadline) fail("Transfer never reached the gate");
            Thread.sleep(10);
        }
        return download;
    }

    // ============================================================
    // CONSTRUCTOR TESTS
    // ============================================================

    @Test
    void testConstructorInvalidArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> new DownloadManager(null, connection, store));
        assertThrows(IllegalArgumentException.class, () -> new DownloadManager(config, null, store));
        assertThrows(IllegalArgumentException.class, () -> new DownloadManager(config, connection, null));
        assertThrows(IllegalArgumentException.class, () -> new DownloadManager(null));
    }

    @Test
    void testConstructorWithConfigOnly() throws IOException
    {
        DownloadManager standalone = new DownloadManager(config);

        assertTrue(standalone.getAllDownloads().isEmpty());
        assertTrue(Files.isDirectory(tempDir.resolve("checkpoints")));
    }

    // ============================================================
    // START TESTS
    // ============================================================

    @Test
    void testStartDownload() throws Exception
    {
        Download download = manager.startDownload(URL, dest("report.bin"));

        assertSame(download, manager.getDownload(download.getId()));
        assertTrue(download.isStarted());
        DownloadResult result = download.awaitCompletion(20, TimeUnit.SECONDS);
        assertTrue(result.isSuccessful(), result.toString());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("report.bin")));
    }

    @Test
    void testStartDownloadInvalidArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> manager.startDownload(null, dest("a.bin")));
        assertThrows(IllegalArgumentException.class, () -> manager.startDownload(" ", dest("a.bin")));
        assertThrows(IllegalArgumentException.class, () -> manager.startDownload(URL, null));
        assertThrows(IllegalArgumentException.class, () -> manager.startDownload(URL, ""));
        assertTrue(manager.getAllDownloads().isEmpty());
    }

    @Test
    void testSameDestinationIsRejectedWhileActive() throws Exception
    {
        Download first = startHeld(dest("shared.bin"));

        assertThrows(IllegalArgumentException.class, () -> manager.startDownload(OTHER_URL, dest("shared.bin")));
        assertEquals(1, manager.getAllDownloads().size());

        connection.openGate();
        first.awaitCompletion(20, TimeUnit.SECONDS);
        Download second = manager.startDownload(OTHER_URL, dest("shared.bin"));
        assertTrue(second.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
    }

    @Test
    void testMultipleDownloads() throws Exception
    {
        Download first = manager.startDownload(URL, dest("one.bin"));
        Download second = manager.startDownload(OTHER_URL, dest("two.bin"));

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, manager.getAllDownloads().size());
        assertTrue(first.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertTrue(second.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("one.bin")));
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("two.bin")));
    }

    @Test
    void testStartDownloadToDirectoryUsesUrlFileName() throws Exception
    {
        Download download = manager.startDownloadToDirectory(URL, tempDir.toString());

        assertEquals(tempDir.resolve("report.bin").toAbsolutePath().normalize().toString(), download.getDestination());
        assertTrue(download.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
    }

    @Test
    void testStartDownloadToDirectoryUsesContentDisposition() throws Exception
    {
        byte[] data = ScriptedConnection.pattern(5000, 2);
        LocalRangeServer server = new LocalRangeServer(data, "\"d1\"");
        server.setContentDisposition("attachment; filename=\"quarterly.csv\"");
        DownloadManager httpManager = new DownloadManager(config);
        try
        {
            Download download = httpManager.startDownloadToDirectory(server.url(), tempDir.toString());

            assertTrue(download.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
            assertArrayEquals(data, Files.readAllBytes(tempDir.resolve("quarterly.csv")));
        }
        finally
        {
            httpManager.shutdown();
            server.stop();
        }
    }

    @Test
    void testStartDownloadToDirectoryReportsProbeFailure()
    {
        connection.failProbe(new HttpStatusException(404, "Not Found"));

        DownloadException ex = assertThrows(DownloadException.class,
            () -> manager.startDownloadToDirectory(URL, tempDir.toString()));

        assertEquals(FailureKind.RESOURCE_NOT_FOUND, ex.getKind());
        assertTrue(manager.getAllDownloads().isEmpty());
    }

    // ============================================================
    // CONTROL BY ID TESTS
    // ============================================================

    @Test
    void testPauseAndResumeById() throws Exception
    {
        Download download = startHeld(dest("report.bin"));

        manager.pauseDownload(download.getId());
        assertTrue(download.awaitIdle(10, TimeUnit.SECONDS));
        assertEquals(DownloadState.PAUSED, download.getState());

        connection.openGate();
        manager.resumeDownload(download.getId());
        assertTrue(download.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("report.bin")));
    }

    @Test
    void testResumeCompletedDownloadThrowsException() throws Exception
    {
        Download download = manager.startDownload(URL, dest("report.bin"));
        download.awaitCompletion(20, TimeUnit.SECONDS);

        assertThrows(IllegalStateException.class, () -> manager.resumeDownload(download.getId()));
    }

    @Test
    void testCancelById() throws Exception
    {
        Download download = startHeld(dest("report.bin"));

        manager.cancelDownload(download.getId());

        DownloadResult result = download.awaitCompletion(20, TimeUnit.SECONDS);
        assertEquals(DownloadState.CANCELLED, result.getState());
        assertNull(manager.getDownload(download.getId()));
        assertFalse(Files.exists(download.getPartFile()));
    }

    @Test
    void testInvalidIds()
    {
        assertThrows(IllegalArgumentException.class, () -> manager.pauseDownload(null));
        assertThrows(IllegalArgumentException.class, () -> manager.resumeDownload(""));
        assertThrows(IllegalArgumentException.class, () -> manager.cancelDownload("no-such-download"));
        assertNull(manager.getDownload(null));
        assertNull(manager.getDownload("no-such-download"));
    }

    // ============================================================
    // PERSISTENCE TESTS
    // ============================================================

    @Test
    void testShutdownPausesAndAnotherManagerResumes() throws Exception
    {
        Download download = startHeld(dest("report.bin"));

        manager.shutdown();

        assertEquals(DownloadState.PAUSED, download.getState());
        assertTrue(manager.getAllDownloads().isEmpty());
        assertEquals(DownloadState.PAUSED, store.load(download.getId()).orElseThrow().getState());

        connection.openGate();
        connection.clearFetches();
        DownloadManager restarted = new DownloadManager(config, connection, store);
        List<Download> resumed = restarted.resumeAll();

        assertEquals(1, resumed.size());
        Download restored = resumed.get(0);
        assertEquals(download.getId(), restored.getId());
        assertTrue(restored.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertTrue(restored.isRestoredFromCheckpoint());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("report.bin")));
        // segments 0 and 1 finished before the pause
        assertFalse(connection.getFetchStarts().contains(0L));
        assertFalse(connection.getFetchStarts().contains(250L));
        restarted.shutdown();
    }

    @Test
    void testLoadDownloadsRegistersWithoutStarting() throws Exception
    {
        Download download = startHeld(dest("report.bin"));
        manager.shutdown();

        DownloadManager restarted = new DownloadManager(config, connection, store);
        List<Download> loaded = restarted.loadDownloads();

        assertEquals(1, loaded.size());
        Download pending = restarted.getDownload(download.getId());
        assertNotNull(pending);
        assertFalse(pending.isStarted());
        assertEquals(download.getDestination(), pending.getDestination());
        // loading twice does not duplicate
        assertTrue(restarted.loadDownloads().isEmpty());

        connection.openGate();
        restarted.resumeDownload(pending.getId());
        assertTrue(pending.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        restarted.shutdown();
    }

    @Test
    void testResumeAllRetriesExhaustedDownloadInSameManager() throws Exception
    {
        connection.failFetch(750, 3, new IOException("Connection reset"));
        Download failed = manager.startDownload(URL, dest("report.bin"));
        DownloadResult first = failed.awaitCompletion(20, TimeUnit.SECONDS);
        assertEquals(DownloadOutcome.RETRYABLE_FAILURE_EXHAUSTED, first.getOutcome());
        assertTrue(first.isResumable());
        assertTrue(store.load(failed.getId()).isPresent());

        connection.clearFetches();
        List<Download> resumed = manager.resumeAll();

        assertEquals(1, resumed.size());
        Download retry = resumed.get(0);
        assertNotSame(failed, retry);
        assertEquals(failed.getId(), retry.getId());
        assertSame(retry, manager.getDownload(failed.getId()));
        assertTrue(retry.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertTrue(retry.isRestoredFromCheckpoint());
        assertEquals(Collections.singletonList(750L), connection.getFetchStarts());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("report.bin")));
        // nothing left to resume
        assertTrue(manager.resumeAll().isEmpty());
    }

    @Test
    void testResumeDownloadByIdAfterExhaustedRetries() throws Exception
    {
        connection.failFetch(750, 3, new IOException("Connection reset"));
        Download failed = manager.startDownload(URL, dest("report.bin"));
        assertFalse(failed.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());

        manager.resumeDownload(failed.getId());

        Download retry = manager.getDownload(failed.getId());
        assertNotSame(failed, retry);
        assertTrue(retry.awaitCompletion(20, TimeUnit.SECONDS).isSuccessful());
        assertArrayEquals(content, Files.readAllBytes(tempDir.resolve("report.bin")));
    }

    @Test
    void testFailureWithoutCheckpointIsNotResumed() throws Exception
    {
        connection.failProbe(new HttpStatusException(404, "Not Found"));
        Download failed = manager.startDownload(URL, dest("report.bin"));
        DownloadResult result = failed.awaitCompletion(20, TimeUnit.SECONDS);
        assertEquals(FailureKind.RESOURCE_NOT_FOUND, result.getFailureKind());
        assertFalse(store.load(failed.getId()).isPresent());

        assertTrue(manager.resumeAll().isEmpty());
        assertThrows(IllegalStateException.class, () -> manager.resumeDownload(failed.getId()));
        assertSame(failed, manager.getDownload(failed.getId()));
    }

    @Test
    void testShutdownWithNothingRunning()
    {
        assertDoesNotThrow(manager::shutdown);
        assertTrue(manager.getAllDownloads().isEmpty());
    }
}
