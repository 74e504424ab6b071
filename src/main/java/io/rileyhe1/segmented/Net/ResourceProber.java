package io.rileyhe1.segmented.Net;

import java.io.IOException;
import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.DownloadException;
import io.rileyhe1.segmented.Data.FailureKind;
import io.rileyhe1.segmented.Data.ResourceMetadata;

/**
 * Determines size, range support and validator of a resource before planning.
 */
public class ResourceProber
{
    private static final Logger logger = LoggerFactory.getLogger(ResourceProber.class);

    public static final String DEFAULT_FILE_NAME = "download_file";

    private final RangeConnection connection;

    public ResourceProber(RangeConnection connection)
    {
        if(connection == null) throw new IllegalArgumentException("Connection cannot be null");
        this.connection = connection;
    }

    /**
     * @throws DownloadException RESOURCE_NOT_FOUND for 404/410, PROBE_FAILED for anything else
     */
    public ResourceMetadata probe(URI uri) throws DownloadException
    {
        if(uri == null) throw new IllegalArgumentException("URI cannot be null");
        ResourceMetadata metadata;
        try
        {
            metadata = connection.probe(uri);
        }
        catch(HttpStatusException e)
        {
            if(e.getStatusCode() == 404 || e.getStatusCode() == 410)
            {
                throw new DownloadException(FailureKind.RESOURCE_NOT_FOUND, "Resource not found: " + uri, e);
            }
            throw new DownloadException(FailureKind.PROBE_FAILED, "Probe of " + uri + " was refused: " + e.getMessage(), e);
        }
        catch(IOException | RuntimeException e)
        {
            throw new DownloadException(FailureKind.PROBE_FAILED, "Failed to retrieve metadata from " + uri, e);
        }
        if(metadata == null)
        {
            throw new DownloadException(FailureKind.PROBE_FAILED, "Probe of " + uri + " returned no metadata");
        }

        if(metadata.getFileName() == null)
        {
            metadata = metadata.withFileName(fileNameFromPath(uri));
        }
        logger.debug("Probed {}: {}", uri, metadata);
        return metadata;
    }

    // last path segment, or a fixed fallback name
    public static String fileNameFromPath(URI uri)
    {
        String path = uri.getPath();
        if(path != null)
        {
            String[] parts = path.split("/");
            for(int i = parts.length - 1; i >= 0; i--)
            {
                if(!parts[i].isEmpty()) return parts[i];
            }
        }
        return DEFAULT_FILE_NAME;
    }
}
