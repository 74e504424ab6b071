import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process HTTP server for one resource at {@link #PATH}. Honors single byte ranges and
 * If-Match, and can be told to refuse HEAD, ignore Range, fail ranges starting at an
 * offset, or serve a body without a length.
 */
class LocalRangeServer
{
    static final String PATH = "/files/data.bin";

    private final HttpServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    private final Map<Long, Deque<Integer>> failures = new ConcurrentHashMap<>();

    private volatile byte[] content;
    private volatile String etag;
    private volatile boolean headAllowed = true;
    private volatile boolean acceptRanges = true;
    private volatile boolean ignoreRange = false;
    private volatile boolean chunked = false;
    private volatile String contentDisposition;

    LocalRangeServer(byte[] content, String etag) throws IOException
    {
        this.content = content;
        this.etag = etag;
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    String url()
    {
        return url(PATH);
    }

    String url(String path)
    {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    void stop()
    {
        server.stop(0);
        executor.shutdownNow();
    }

    // ============================================================
    // SCRIPTING
    // ============================================================

    void setContent(byte[] content, String etag)
    {
        this.content = content;
        this.etag = etag;
    }

    void setHeadAllowed(boolean headAllowed)
    {
        this.headAllowed = headAllowed;
    }

    void setAcceptRanges(boolean acceptRanges)
    {
        this.acceptRanges = acceptRanges;
    }

    void setIgnoreRange(boolean ignoreRange)
    {
        this.ignoreRange = ignoreRange;
    }

    void setChunked(boolean chunked)
    {
        this.chunked = chunked;
    }

    void setContentDisposition(String contentDisposition)
    {
        this.contentDisposition = contentDisposition;
    }

    // the next `times` GETs whose range starts at `start` answer `status`
    void failRange(long start, int times, int status)
    {
        for(int i = 0; i < times; i++)
        {
            failures.computeIfAbsent(start, k -> new ArrayDeque<>()).add(status);
        }
    }

    // "METHOD range-or-dash" per request
    List<String> getRequests()
    {
        synchronized(requests)
        {
            return new ArrayList<>(requests);
        }
    }

    // ============================================================
    // HANDLER
    // ============================================================

    private void handle(HttpExchange exchange) throws IOException
    {
        try
        {
            String method = exchange.getRequestMethod();
            String range = exchange.getRequestHeaders().getFirst("Range");
            requests.add(method + " " + (range == null ? "-" : range));

            if(!PATH.equals(exchange.getRequestURI().getPath()))
            {
                exchange.sendResponseHeaders(404, -1);
                return;
            }

            byte[] data = content;
            String currentTag = etag;
            Headers headers = exchange.getResponseHeaders();
            headers.set("Content-Type", "application/octet-stream");
            if(currentTag != null) headers.set("ETag", currentTag);
            if(contentDisposition != null) headers.set("Content-Disposition", contentDisposition);
            if(acceptRanges) headers.set("Accept-Ranges", "bytes");

            if("HEAD".equals(method))
            {
                if(!headAllowed)
                {
                    exchange.sendResponseHeaders(405, -1);
                    return;
                }
                if(!chunked) headers.set("Content-Length", String.valueOf(data.length));
                exchange.sendResponseHeaders(200, -1);
                return;
            }

            String ifMatch = exchange.getRequestHeaders().getFirst("If-Match");
            if(ifMatch != null && currentTag != null && !ifMatch.equals(currentTag))
            {
                exchange.sendResponseHeaders(412, -1);
                return;
            }

            long[] requested = range == null || ignoreRange ? null : parseRange(range, data.length);
            if(requested != null)
            {
                Deque<Integer> queue = failures.get(requested[0]);
                Integer status = queue == null ? null : queue.poll();
                if(status != null)
                {
                    exchange.sendResponseHeaders(status, -1);
                    return;
                }
                if(requested[0] >= data.length)
                {
                    headers.set("Content-Range", "bytes */" + data.length);
                    exchange.sendResponseHeaders(416, -1);
                    return;
                }
                long end = Math.min(requested[1], data.length - 1);
                int length = (int) (end - requested[0] + 1);
                headers.set("Content-Range", "bytes " + requested[0] + "-" + end + "/" + data.length);
                exchange.sendResponseHeaders(206, length);
                try(OutputStream out = exchange.getResponseBody())
                {
                    out.write(data, (int) requested[0], length);
                }
                return;
            }

            exchange.sendResponseHeaders(200, chunked ? 0 : data.length);
            try(OutputStream out = exchange.getResponseBody())
            {
                out.write(data);
            }
        }
        catch(IOException e)
        {
            // client went away mid-body
        }
        finally
        {
            exchange.close();
        }
    }

    // "bytes=a-b" or "bytes=a-"
    private static long[] parseRange(String header, long size)
    {
        if(!header.startsWith("bytes=")) return null;
        String value = header.substring("bytes=".length());
        int dash = value.indexOf('-');
        if(dash <= 0) return null;
        long start = Long.parseLong(value.substring(0, dash));
        String endPart = value.substring(dash + 1);
        long end = endPart.isEmpty() ? size - 1 : Long.parseLong(endPart);
        return new long[] {start, end};
    }
}
