package io.rileyhe1.segmented.Data;

/**
 * What a metadata probe learned about a remote resource.
 */
public class ResourceMetadata
{
    public static final long UNKNOWN_SIZE = -1L;

    private final long totalSize;
    private final boolean supportsRanges;
    private final Validator validator;
    private final String contentType;
    private final String fileName;

    public ResourceMetadata(long totalSize, boolean supportsRanges, Validator validator, String contentType, String fileName)
    {
        if(totalSize < UNKNOWN_SIZE) throw new IllegalArgumentException("Total size cannot be negative: " + totalSize);
        this.totalSize = totalSize;
        this.supportsRanges = supportsRanges;
        this.validator = validator;
        this.contentType = contentType;
        this.fileName = fileName;
    }

    public long getTotalSize()
    {
        return totalSize;
    }

    public boolean isSizeKnown()
    {
        return totalSize != UNKNOWN_SIZE;
    }

    public boolean supportsRanges()
    {
        return supportsRanges;
    }

    // may be null
    public Validator getValidator()
    {
        return validator;
    }

    public String getContentType()
    {
        return contentType;
    }

    public String getFileName()
    {
        return fileName;
    }

    public ResourceMetadata withFileName(String fileName)
    {
        return new ResourceMetadata(totalSize, supportsRanges, validator, contentType, fileName);
    }

    @Override
    public String toString()
    {
        return "ResourceMetadata{totalSize=" + (isSizeKnown() ? String.valueOf(totalSize) : "unknown")
            + ", supportsRanges=" + supportsRanges
            + ", validator=" + validator
            + ", contentType=" + contentType
            + ", fileName=" + fileName + "}";
    }
}
