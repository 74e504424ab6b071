package io.rileyhe1.segmented.Data;

public class DownloadException extends Exception
{
    private final FailureKind kind;
    private final String downloadId;
    private final String url;

    // used when we don't have download context yet
    public DownloadException(FailureKind kind, String message)
    {
        this(kind, message, null, null, null);
    }

    // used to wrap a lower level failure when we need to catch and rethrow it
    public DownloadException(FailureKind kind, String message, Throwable cause)
    {
        this(kind, message, cause, null, null);
    }

    // full context + underlying cause
    public DownloadException(FailureKind kind, String message, Throwable cause, String downloadId, String url)
    {
        super(message, cause);
        if(kind == null) throw new IllegalArgumentException("Failure kind cannot be null");
        this.kind = kind;
        this.downloadId = downloadId;
        this.url = url;
    }

    public FailureKind getKind()
    {
        return kind;
    }

    public String getDownloadId()
    {
        return downloadId;
    }

    public String getUrl()
    {
        return url;
    }

    public boolean isResumable()
    {
        return kind.isResumable();
    }

    // re-attaches transfer context to an exception raised deeper down the stack
    public DownloadException withContext(String downloadId, String url)
    {
        if(this.downloadId != null) return this;
        DownloadException copy = new DownloadException(kind, getMessage(), getCause(), downloadId, url);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("DownloadException[").append(kind).append("]: ");
        sb.append(getMessage());

        if (downloadId != null)
        {
            sb.append(" [downloadId=").append(downloadId).append("]");
        }

        if (url != null)
        {
            sb.append(" [url=").append(url).append("]");
        }

        if (getCause() != null)
        {
            sb.append(" caused by ").append(getCause().getClass().getSimpleName());
            sb.append(": ").append(getCause().getMessage());
        }

        return sb.toString();
    }
}
