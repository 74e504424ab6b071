import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Validator;
import io.rileyhe1.segmented.Net.HttpStatusException;
import io.rileyhe1.segmented.Net.ResourceProber;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ResourceProber class.
 */
class ResourceProberTest
{
    private static final URI URI_WITH_NAME = URI.create("https://example.com/files/archive.tar.gz");

    @Test
    void testProbeFillsFileNameFromPath() throws DownloadException
    {
        ScriptedConnection connection = new ScriptedConnection(new byte[100], Validator.etag("\"x\""));

        ResourceMetadata metadata = new ResourceProber(connection).probe(URI_WITH_NAME);

        assertEquals(100, metadata.getTotalSize());
        assertEquals("archive.tar.gz", metadata.getFileName());
        assertEquals(Validator.etag("\"x\""), metadata.getValidator());
    }

    @Test
    void testFileNameFromPath()
    {
        assertEquals("archive.tar.gz", ResourceProber.fileNameFromPath(URI_WITH_NAME));
        assertEquals("dir", ResourceProber.fileNameFromPath(URI.create("https://example.com/dir/")));
        assertEquals(ResourceProber.DEFAULT_FILE_NAME, ResourceProber.fileNameFromPath(URI.create("https://example.com/")));
        assertEquals(ResourceProber.DEFAULT_FILE_NAME, ResourceProber.fileNameFromPath(URI.create("https://example.com")));
    }

    @Test
    void testNotFoundIsClassified()
    {
        ScriptedConnection connection = new ScriptedConnection(new byte[10], null);
        connection.failProbe(new HttpStatusException(404, "Not Found"));

        DownloadException ex = assertThrows(DownloadException.class, () -> new ResourceProber(connection).probe(URI_WITH_NAME));

        assertEquals(FailureKind.RESOURCE_NOT_FOUND, ex.getKind());
    }

    @Test
    void testGoneIsClassified()
    {
        ScriptedConnection connection = new ScriptedConnection(new byte[10], null);
        connection.failProbe(new HttpStatusException(410, "Gone"));

        DownloadException ex = assertThrows(DownloadException.class, () -> new ResourceProber(connection).probe(URI_WITH_NAME));

        assertEquals(FailureKind.RESOURCE_NOT_FOUND, ex.getKind());
    }

    @Test
    void testOtherFailuresAreProbeFailures()
    {
        ScriptedConnection refused = new ScriptedConnection(new byte[10], null);
        refused.failProbe(new HttpStatusException(403, "Forbidden"));
        ScriptedConnection unreachable = new ScriptedConnection(new byte[10], null);
        unreachable.failProbe(new IOException("Connection refused"));

        assertEquals(FailureKind.PROBE_FAILED,
            assertThrows(DownloadException.class, () -> new ResourceProber(refused).probe(URI_WITH_NAME)).getKind());
        assertEquals(FailureKind.PROBE_FAILED,
            assertThrows(DownloadException.class, () -> new ResourceProber(unreachable).probe(URI_WITH_NAME)).getKind());
    }

    @Test
    void testInvalidArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> new ResourceProber(null));
        ResourceProber prober = new ResourceProber(new ScriptedConnection(new byte[1], null));
        assertThrows(IllegalArgumentException.class, () -> prober.probe(null));
    }
}
