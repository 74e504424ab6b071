package io.rileyhe1.segmented.Net;

import java.net.URI;

import io.rileyhe1.segmented.Data.Segment;
import io.rileyhe1.segmented.Data.Validator;

/**
 * A single fetch: either the byte range [start, end) or, when not ranged, the whole body.
 */
public class RangeRequest
{
    private final URI uri;
    private final long start;
    private final long end;
    private final Validator validator;
    private final boolean ranged;

    private RangeRequest(URI uri, long start, long end, Validator validator, boolean ranged)
    {
        if(uri == null) throw new IllegalArgumentException("URI cannot be null");
        if(start < 0) throw new IllegalArgumentException("Start cannot be negative");
        if(end != Segment.UNBOUNDED && end <= start)
        {
            throw new IllegalArgumentException("Range end must be greater than start. Start: " + start + ", End: " + end);
        }
        this.uri = uri;
        this.start = start;
        this.end = end;
        this.validator = validator;
        this.ranged = ranged;
    }

    /**
     * @param end exclusive end offset, or {@link Segment#UNBOUNDED} for "through the last byte"
     */
    public static RangeRequest range(URI uri, long start, long end, Validator validator)
    {
        return new RangeRequest(uri, start, end, validator, true);
    }

    public static RangeRequest fullBody(URI uri, Validator validator)
    {
        return new RangeRequest(uri, 0, Segment.UNBOUNDED, validator, false);
    }

    public URI getUri()
    {
        return uri;
    }

    public long getStart()
    {
        return start;
    }

    public long getEnd()
    {
        return end;
    }

    public Validator getValidator()
    {
        return validator;
    }

    public boolean isRanged()
    {
        return ranged;
    }

    // value for the Range header, e.g. "bytes=100-199" or "bytes=100-"
    public String toRangeHeader()
    {
        return "bytes=" + start + "-" + (end == Segment.UNBOUNDED ? "" : String.valueOf(end - 1));
    }

    @Override
    public String toString()
    {
        return ranged ? "GET " + uri + " [" + toRangeHeader() + "]" : "GET " + uri;
    }
}
