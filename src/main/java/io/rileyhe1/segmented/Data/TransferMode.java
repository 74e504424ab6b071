package io.rileyhe1.segmented.Data;

/**
 * How the resource is being fetched. Both modes run through the same worker pool;
 * single-stream is a plan with exactly one segment and one connection.
 */
public enum TransferMode
{
    // byte-range requests over several connections
    SEGMENTED,
    // one full-body GET, used when the server does not honour Range or the size is unknown
    SINGLE_STREAM
}
