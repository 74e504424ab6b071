package io.rileyhe1.segmented.Data;

import java.util.Objects;

/**
 * Identity token for one version of a remote resource. A strong ETag is preferred;
 * when the server only offers a weak ETag or none at all, Last-Modified is used.
 */
public final class Validator
{
    public enum Type
    {
        ETAG,
        LAST_MODIFIED
    }

    private final Type type;
    private final String value;

    public Validator(Type type, String value)
    {
        if(type == null) throw new IllegalArgumentException("Validator type cannot be null");
        if(value == null || value.trim().isEmpty()) throw new IllegalArgumentException("Validator value cannot be null or empty");
        this.type = type;
        this.value = value.trim();
    }

    public static Validator etag(String etag)
    {
        return new Validator(Type.ETAG, etag);
    }

    public static Validator lastModified(String lastModified)
    {
        return new Validator(Type.LAST_MODIFIED, lastModified);
    }

    /**
     * Picks the strongest validator the response headers offer.
     *
     * @return the validator, or null when the headers carry nothing usable
     */
    public static Validator fromHeaders(String etag, String lastModified)
    {
        if(etag != null && !etag.trim().isEmpty() && !isWeak(etag))
        {
            return etag(etag);
        }
        if(lastModified != null && !lastModified.trim().isEmpty())
        {
            return lastModified(lastModified);
        }
        return null;
    }

    private static boolean isWeak(String etag)
    {
        return etag.trim().startsWith("W/");
    }

    public Type getType()
    {
        return type;
    }

    public String getValue()
    {
        return value;
    }

    // HTTP precondition header that enforces this validator on a fetch
    public String getConditionalHeader()
    {
        return type == Type.ETAG ? "If-Match" : "If-Unmodified-Since";
    }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) return true;
        if(!(o instanceof Validator)) return false;
        Validator other = (Validator) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, value);
    }

    @Override
    public String toString()
    {
        return type + "(" + value + ")";
    }
}
