package io.rileyhe1.segmented.Net;

import java.io.IOException;

/**
 * A server answered, but with a status the engine cannot use.
 */
public class HttpStatusException extends IOException
{
    public static final int RANGE_NOT_SATISFIABLE = 416;
    public static final int PRECONDITION_FAILED = 412;

    private final int statusCode;

    public HttpStatusException(int statusCode, String message)
    {
        super("HTTP " + statusCode + (message == null || message.isEmpty() ? "" : ": " + message));
        this.statusCode = statusCode;
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public boolean isRangeNotSatisfiable()
    {
        return statusCode == RANGE_NOT_SATISFIABLE;
    }

    public boolean isPreconditionFailed()
    {
        return statusCode == PRECONDITION_FAILED;
    }

    public boolean isServerError()
    {
        return statusCode >= 500 && statusCode < 600;
    }
}
