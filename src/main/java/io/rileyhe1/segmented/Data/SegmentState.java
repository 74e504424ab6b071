package io.rileyhe1.segmented.Data;

public enum SegmentState
{
    PENDING,
    ACTIVE,
    DONE,
    FAILED
}
