package io.rileyhe1.segmented.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Data Transfer Object for persisting a transfer's plan and per-segment progress.
 * Contains only the serializable data needed to rebuild an identical in-memory transfer.
 */
public class Checkpoint
{
    public static final int FORMAT_VERSION = 1;

    private int formatVersion = FORMAT_VERSION;
    private String id;
    private String url;
    private String destination;
    private long totalSize;
    private Validator validator;
    private TransferMode mode;
    private String modeReason;
    private int concurrency;
    private DownloadState state;
    private long updatedAt;
    private List<SegmentRecord> segments;

    // No arg constructor for gson deserialization
    public Checkpoint()
    {
    }

    public Checkpoint(String id, String url, String destination, long totalSize, Validator validator,
                      TransferMode mode, String modeReason, int concurrency, DownloadState state,
                      List<SegmentRecord> segments)
    {
        this.id = id;
        this.url = url;
        this.destination = destination;
        this.totalSize = totalSize;
        this.validator = validator;
        this.mode = mode;
        this.modeReason = modeReason;
        this.concurrency = concurrency;
        this.state = state;
        this.segments = segments == null ? new ArrayList<>() : new ArrayList<>(segments);
        this.updatedAt = System.currentTimeMillis();
    }

    // Getters
    public int getFormatVersion()
    {
        return formatVersion;
    }

    public String getId()
    {
        return id;
    }

    public String getUrl()
    {
        return url;
    }

    public String getDestination()
    {
        return destination;
    }

    public long getTotalSize()
    {
        return totalSize;
    }

    public Validator getValidator()
    {
        return validator;
    }

    public TransferMode getMode()
    {
        return mode;
    }

    public String getModeReason()
    {
        return modeReason;
    }

    public int getConcurrency()
    {
        return concurrency;
    }

    public DownloadState getState()
    {
        return state;
    }

    public long getUpdatedAt()
    {
        return updatedAt;
    }

    public List<SegmentRecord> getSegments()
    {
        return segments;
    }

    // Setters (needed for Gson deserialization)
    public void setFormatVersion(int formatVersion)
    {
        this.formatVersion = formatVersion;
    }

    public void setId(String id)
    {
        this.id = id;
    }

    public void setUrl(String url)
    {
        this.url = url;
    }

    public void setDestination(String destination)
    {
        this.destination = destination;
    }

    public void setTotalSize(long totalSize)
    {
        this.totalSize = totalSize;
    }

    public void setValidator(Validator validator)
    {
        this.validator = validator;
    }

    public void setMode(TransferMode mode)
    {
        this.mode = mode;
    }

    public void setModeReason(String modeReason)
    {
        this.modeReason = modeReason;
    }

    public void setConcurrency(int concurrency)
    {
        this.concurrency = concurrency;
    }

    public void setState(DownloadState state)
    {
        this.state = state;
    }

    public void setUpdatedAt(long updatedAt)
    {
        this.updatedAt = updatedAt;
    }

    public void setSegments(List<SegmentRecord> segments)
    {
        this.segments = segments;
    }
}
