package io.rileyhe1.segmented.Net;

import java.io.IOException;
import java.net.URI;

import io.rileyhe1.segmented.Data.ResourceMetadata;

/**
 * The "fetch a byte range" capability the engine runs on. Implementations report
 * HTTP-level refusals as {@link HttpStatusException} and transport problems as plain
 * {@link IOException}s; deciding what a failure means is left to the caller.
 */
public interface RangeConnection
{
    /**
     * Issues a metadata-only request. Must not transfer the resource body.
     */
    ResourceMetadata probe(URI uri) throws IOException;

    /**
     * Opens a stream for the requested bytes. When the request carries a validator the
     * implementation must send it as a precondition, so a changed resource is refused
     * rather than served.
     */
    RangeResponse fetch(RangeRequest request) throws IOException;
}
