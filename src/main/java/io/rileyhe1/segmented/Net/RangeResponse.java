package io.rileyhe1.segmented.Net;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

import io.rileyhe1.segmented.Data.Validator;

/**
 * An open response body plus the headers the engine checks before trusting it.
 * Closing it releases the underlying connection; closing from another thread is
 * how a blocked read gets interrupted.
 */
public class RangeResponse implements Closeable
{
    public static final long UNKNOWN = -1L;

    private final int statusCode;
    private final boolean partial;
    private final long contentLength;
    private final long rangeStart;
    private final long instanceLength;
    private final Validator validator;
    private final InputStream body;
    private final Closeable onClose;

    /**
     * @param rangeStart first byte offset from Content-Range, or UNKNOWN
     * @param instanceLength full resource size from Content-Range, or UNKNOWN
     */
    public RangeResponse(int statusCode, boolean partial, long contentLength, long rangeStart, long instanceLength,
                         Validator validator, InputStream body, Closeable onClose)
    {
        if(body == null) throw new IllegalArgumentException("Body cannot be null");
        this.statusCode = statusCode;
        this.partial = partial;
        this.contentLength = contentLength;
        this.rangeStart = rangeStart;
        this.instanceLength = instanceLength;
        this.validator = validator;
        this.body = body;
        this.onClose = onClose;
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    // true for 206 Partial Content
    public boolean isPartial()
    {
        return partial;
    }

    public long getContentLength()
    {
        return contentLength;
    }

    public long getRangeStart()
    {
        return rangeStart;
    }

    public long getInstanceLength()
    {
        return instanceLength;
    }

    public Validator getValidator()
    {
        return validator;
    }

    public InputStream getBody()
    {
        return body;
    }

    @Override
    public void close() throws IOException
    {
        try
        {
            body.close();
        }
        finally
        {
            if(onClose != null) onClose.close();
        }
    }
}
