package io.rileyhe1.segmented.Net;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.segmented.Data.DownloadConfig;
import io.rileyhe1.segmented.Data.ResourceMetadata;
import io.rileyhe1.segmented.Data.Validator;

/**
 * {@link RangeConnection} over {@link HttpURLConnection}.
 */
public class HttpRangeConnection implements RangeConnection
{
    private static final Logger logger = LoggerFactory.getLogger(HttpRangeConnection.class);

    private final int connectionTimeout;
    private final int readTimeout;
    private final String userAgent;

    public HttpRangeConnection(DownloadConfig config)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        this.connectionTimeout = config.getConnectionTimeout();
        this.readTimeout = config.getReadTimeout();
        this.userAgent = config.getUserAgent();
    }

    @Override
    public ResourceMetadata probe(URI uri) throws IOException
    {
        HttpURLConnection connection = open(uri, "HEAD");
        try
        {
            int responseCode = connection.getResponseCode();
            if(responseCode == HttpURLConnection.HTTP_BAD_METHOD || responseCode == HttpURLConnection.HTTP_NOT_IMPLEMENTED)
            {
                logger.debug("HEAD refused by {} ({}), probing with a one byte range", uri, responseCode);
                return probeWithRange(uri);
            }
            if(responseCode < 200 || responseCode > 299)
            {
                throw new HttpStatusException(responseCode, connection.getResponseMessage());
            }

            long contentLength = connection.getContentLengthLong();
            String acceptRanges = connection.getHeaderField("Accept-Ranges");
            boolean supportsRanges = acceptRanges != null && acceptRanges.toLowerCase(Locale.ROOT).contains("bytes");
            return new ResourceMetadata(
                contentLength >= 0 ? contentLength : ResourceMetadata.UNKNOWN_SIZE,
                supportsRanges,
                Validator.fromHeaders(connection.getHeaderField("ETag"), connection.getHeaderField("Last-Modified")),
                connection.getContentType(),
                parseContentDispositionFileName(connection.getHeaderField("Content-Disposition")));
        }
        finally
        {
            connection.disconnect();
        }
    }

    // GET bytes=0-0: the Content-Range total gives the size without sending the body
    private ResourceMetadata probeWithRange(URI uri) throws IOException
    {
        HttpURLConnection connection = open(uri, "GET");
        try
        {
            connection.setRequestProperty("Range", "bytes=0-0");
            int responseCode = connection.getResponseCode();
            Validator validator = Validator.fromHeaders(connection.getHeaderField("ETag"), connection.getHeaderField("Last-Modified"));
            String fileName = parseContentDispositionFileName(connection.getHeaderField("Content-Disposition"));
            if(responseCode == HttpURLConnection.HTTP_PARTIAL)
            {
                long[] contentRange = parseContentRange(connection.getHeaderField("Content-Range"));
                long total = contentRange != null && contentRange[2] >= 0 ? contentRange[2] : ResourceMetadata.UNKNOWN_SIZE;
                return new ResourceMetadata(total, true, validator, connection.getContentType(), fileName);
            }
            if(responseCode == HttpURLConnection.HTTP_OK)
            {
                long contentLength = connection.getContentLengthLong();
                return new ResourceMetadata(contentLength >= 0 ? contentLength : ResourceMetadata.UNKNOWN_SIZE,
                    false, validator, connection.getContentType(), fileName);
            }
            throw new HttpStatusException(responseCode, connection.getResponseMessage());
        }
        finally
        {
            // disconnecting without reading keeps the body off the wire
            connection.disconnect();
        }
    }

    @Override
    public RangeResponse fetch(RangeRequest request) throws IOException
    {
        HttpURLConnection connection = open(request.getUri(), "GET");
        boolean handedOff = false;
        try
        {
            if(request.isRanged())
            {
                connection.setRequestProperty("Range", request.toRangeHeader());
            }
            Validator validator = request.getValidator();
            if(validator != null)
            {
                connection.setRequestProperty(validator.getConditionalHeader(), validator.getValue());
            }

            int responseCode = connection.getResponseCode();
            if(responseCode != HttpURLConnection.HTTP_OK && responseCode != HttpURLConnection.HTTP_PARTIAL)
            {
                throw new HttpStatusException(responseCode, connection.getResponseMessage());
            }

            long rangeStart = RangeResponse.UNKNOWN;
            long instanceLength = RangeResponse.UNKNOWN;
            if(responseCode == HttpURLConnection.HTTP_PARTIAL)
            {
                long[] contentRange = parseContentRange(connection.getHeaderField("Content-Range"));
                if(contentRange != null)
                {
                    rangeStart = contentRange[0];
                    instanceLength = contentRange[2];
                }
            }

            InputStream body = connection.getInputStream();
            RangeResponse response = new RangeResponse(
                responseCode,
                responseCode == HttpURLConnection.HTTP_PARTIAL,
                connection.getContentLengthLong(),
                rangeStart,
                instanceLength,
                Validator.fromHeaders(connection.getHeaderField("ETag"), connection.getHeaderField("Last-Modified")),
                body,
                connection::disconnect);
            handedOff = true;
            return response;
        }
        finally
        {
            if(!handedOff) connection.disconnect();
        }
    }

    private HttpURLConnection open(URI uri, String method) throws IOException
    {
        HttpURLConnection connection = (HttpURLConnection) uri.toURL().openConnection();
        connection.setRequestMethod(method);
        connection.setConnectTimeout(connectionTimeout);
        connection.setReadTimeout(readTimeout);
        connection.setRequestProperty("User-Agent", userAgent);
        // compressed bodies would break offset arithmetic
        connection.setRequestProperty("Accept-Encoding", "identity");
        return connection;
    }

    /**
     * Parses "bytes start-end/total" (or "bytes * /total").
     *
     * @return {start, endInclusive, total} with -1 for unknown parts, or null if unparseable
     */
    public static long[] parseContentRange(String header)
    {
        if(header == null) return null;
        String value = header.trim();
        if(!value.toLowerCase(Locale.ROOT).startsWith("bytes")) return null;
        value = value.substring(5).trim();
        int slash = value.indexOf('/');
        if(slash < 0) return null;
        String range = value.substring(0, slash).trim();
        String total = value.substring(slash + 1).trim();
        try
        {
            long totalSize = "*".equals(total) ? -1L : Long.parseLong(total);
            if("*".equals(range)) return new long[] {-1L, -1L, totalSize};
            int dash = range.indexOf('-');
            if(dash < 0) return null;
            long start = Long.parseLong(range.substring(0, dash).trim());
            long end = Long.parseLong(range.substring(dash + 1).trim());
            return new long[] {start, end, totalSize};
        }
        catch(NumberFormatException e)
        {
            return null;
        }
    }

    public static String parseContentDispositionFileName(String header)
    {
        if(header == null) return null;
        for(String part : header.split(";"))
        {
            String trimmed = part.trim();
            if(trimmed.toLowerCase(Locale.ROOT).startsWith("filename="))
            {
                String name = trimmed.substring("filename=".length()).trim();
                name = name.replaceAll("^[\"']+|[\"']+$", "");
                return name.isEmpty() ? null : name;
            }
        }
        return null;
    }
}
