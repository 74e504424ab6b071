package io.rileyhe1.segmented.Data;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DownloadConfig
{
    private static final Logger logger = LoggerFactory.getLogger(DownloadConfig.class);

    public static final String PROPERTIES_FILE = "segmented-downloader.properties";
    private static final String PREFIX = "segmented.";

    private final int maxConnections;
    private final long minSegmentSize;
    private final int connectionTimeout;
    private final int readTimeout;
    private final int maxAttempts;
    private final long retryDelayMS;
    private final long maxRetryDelayMS;
    private final double backoffMultiplier;
    private final int bufferSize;
    private final String checkpointDirectory;
    private final long checkpointMaxAgeMS;
    private final long checkpointIntervalMS;
    private final long progressIntervalMS;
    private final boolean resumePartialSegments;
    private final int maxPlanRestarts;
    private final String userAgent;

    public DownloadConfig(Builder builder)
    {
        this.maxConnections = builder.maxConnections;
        this.minSegmentSize = builder.minSegmentSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.readTimeout = builder.readTimeout;
        this.maxAttempts = builder.maxAttempts;
        this.retryDelayMS = builder.retryDelayMS;
        this.maxRetryDelayMS = builder.maxRetryDelayMS;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.bufferSize = builder.bufferSize;
        this.checkpointDirectory = builder.checkpointDirectory;
        this.checkpointMaxAgeMS = builder.checkpointMaxAgeMS;
        this.checkpointIntervalMS = builder.checkpointIntervalMS;
        this.progressIntervalMS = builder.progressIntervalMS;
        this.resumePartialSegments = builder.resumePartialSegments;
        this.maxPlanRestarts = builder.maxPlanRestarts;
        this.userAgent = builder.userAgent;
    }

    public int getMaxConnections()
    {
        return maxConnections;
    }

    public long getMinSegmentSize()
    {
        return minSegmentSize;
    }

    public int getConnectionTimeout()
    {
        return connectionTimeout;
    }

    public int getReadTimeout()
    {
        return readTimeout;
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    public long getRetryDelayMS()
    {
        return retryDelayMS;
    }

    public long getMaxRetryDelayMS()
    {
        return maxRetryDelayMS;
    }

    public double getBackoffMultiplier()
    {
        return backoffMultiplier;
    }

    public int getBufferSize()
    {
        return bufferSize;
    }

    public String getCheckpointDirectory()
    {
        return checkpointDirectory;
    }

    public long getCheckpointMaxAgeMS()
    {
        return checkpointMaxAgeMS;
    }

    public long getCheckpointIntervalMS()
    {
        return checkpointIntervalMS;
    }

    public long getProgressIntervalMS()
    {
        return progressIntervalMS;
    }

    public boolean isResumePartialSegments()
    {
        return resumePartialSegments;
    }

    public int getMaxPlanRestarts()
    {
        return maxPlanRestarts;
    }

    public String getUserAgent()
    {
        return userAgent;
    }

    /**
     * Creates a new builder with default values
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Loads configuration from, in increasing priority: built-in defaults, a
     * segmented-downloader.properties on the classpath, one in the working directory,
     * and JVM system properties.
     */
    public static DownloadConfig load()
    {
        Properties properties = new Properties();
        try(InputStream in = DownloadConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE))
        {
            if(in != null)
            {
                properties.load(in);
                logger.debug("Loaded {} from classpath", PROPERTIES_FILE);
            }
        }
        catch(IOException e)
        {
            logger.warn("Failed to read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
        }

        Path local = Paths.get(PROPERTIES_FILE);
        if(Files.isRegularFile(local))
        {
            try(Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8))
            {
                properties.load(reader);
                logger.info("Loaded configuration from {}", local.toAbsolutePath());
            }
            catch(IOException e)
            {
                logger.warn("Failed to read {}: {}", local.toAbsolutePath(), e.getMessage());
            }
        }

        for(String name : System.getProperties().stringPropertyNames())
        {
            if(name.startsWith(PREFIX))
            {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Maps segmented.* keys onto a builder. Unparseable or out-of-range values are
     * logged and the default is kept.
     */
    public static DownloadConfig fromProperties(Properties properties)
    {
        Builder builder = new Builder();
        if(properties == null) return builder.build();

        apply(properties, "max.connections", v -> builder.maxConnections(Integer.parseInt(v)));
        apply(properties, "min.segment.size", v -> builder.minSegmentSize(Long.parseLong(v)));
        apply(properties, "connection.timeout.ms", v -> builder.connectionTimeout(Integer.parseInt(v)));
        apply(properties, "read.timeout.ms", v -> builder.readTimeout(Integer.parseInt(v)));
        apply(properties, "max.attempts", v -> builder.maxAttempts(Integer.parseInt(v)));
        apply(properties, "retry.delay.ms", v -> builder.retryDelayMS(Long.parseLong(v)));
        apply(properties, "retry.max.delay.ms", v -> builder.maxRetryDelayMS(Long.parseLong(v)));
        apply(properties, "retry.backoff.multiplier", v -> builder.backoffMultiplier(Double.parseDouble(v)));
        apply(properties, "buffer.size", v -> builder.bufferSize(Integer.parseInt(v)));
        apply(properties, "checkpoint.dir", builder::checkpointDirectory);
        apply(properties, "checkpoint.max.age.ms", v -> builder.checkpointMaxAgeMS(Long.parseLong(v)));
        apply(properties, "checkpoint.interval.ms", v -> builder.checkpointIntervalMS(Long.parseLong(v)));
        apply(properties, "progress.interval.ms", v -> builder.progressIntervalMS(Long.parseLong(v)));
        apply(properties, "resume.partial.segments", v -> builder.resumePartialSegments(Boolean.parseBoolean(v)));
        apply(properties, "max.plan.restarts", v -> builder.maxPlanRestarts(Integer.parseInt(v)));
        apply(properties, "user.agent", builder::userAgent);
        return builder.build();
    }

    private interface Setter
    {
        void set(String value);
    }

    private static void apply(Properties properties, String key, Setter setter)
    {
        String value = properties.getProperty(PREFIX + key);
        if(value == null) return;
        try
        {
            setter.set(value.trim());
        }
        catch(IllegalArgumentException e)
        {
            // NumberFormatException lands here too
            logger.warn("Invalid value for {}{}: '{}' ({}). Using default.", PREFIX, key, value, e.getMessage());
        }
    }

    public static class Builder
    {
        private int maxConnections = 8;
        private long minSegmentSize = 1024 * 1024; // 1 MB
        private int connectionTimeout = 30000; // 30 seconds
        private int readTimeout = 30000; // 30 seconds
        private int maxAttempts = 5;
        private long retryDelayMS = 500;
        private long maxRetryDelayMS = 30000;
        private double backoffMultiplier = 2.0;
        private int bufferSize = 8192; // 8 KB
        private String checkpointDirectory = Paths.get(System.getProperty("java.io.tmpdir"), "segmented-downloader", "checkpoints").toString();
        private long checkpointMaxAgeMS = 7L * 24 * 60 * 60 * 1000; // 7 days
        private long checkpointIntervalMS = 2000;
        private long progressIntervalMS = 250;
        private boolean resumePartialSegments = true;
        private int maxPlanRestarts = 3;
        private String userAgent = "segmented-downloader/1.0";

        public Builder maxConnections(int maxConnections)
        {
            if (maxConnections < 1)
            {
                throw new IllegalArgumentException("Max connections must be at least 1");
            }
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder minSegmentSize(long minSegmentSize)
        {
            if (minSegmentSize < 1)
            {
                throw new IllegalArgumentException("Min segment size must be at least 1 byte");
            }
            this.minSegmentSize = minSegmentSize;
            return this;
        }

        public Builder connectionTimeout(int connectionTimeout)
        {
            if (connectionTimeout < 0)
            {
                throw new IllegalArgumentException("Connection timeout cannot be negative");
            }
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder readTimeout(int readTimeout)
        {
            if (readTimeout < 0)
            {
                throw new IllegalArgumentException("Read timeout cannot be negative");
            }
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder maxAttempts(int maxAttempts)
        {
            if (maxAttempts < 1)
            {
                throw new IllegalArgumentException("Max attempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelayMS(long retryDelayMS)
        {
            if (retryDelayMS < 0)
            {
                throw new IllegalArgumentException("Retry delay cannot be negative");
            }
            this.retryDelayMS = retryDelayMS;
            return this;
        }

        public Builder maxRetryDelayMS(long maxRetryDelayMS)
        {
            if (maxRetryDelayMS < 0)
            {
                throw new IllegalArgumentException("Max retry delay cannot be negative");
            }
            this.maxRetryDelayMS = maxRetryDelayMS;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier)
        {
            if (backoffMultiplier < 1.0 || Double.isNaN(backoffMultiplier))
            {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
            }
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder bufferSize(int bufferSize)
        {
            if (bufferSize < 256)
            {
                throw new IllegalArgumentException("Buffer size must be at least 256 bytes");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder checkpointDirectory(String checkpointDirectory)
        {
            if (checkpointDirectory == null || checkpointDirectory.trim().isEmpty())
            {
                throw new IllegalArgumentException("Checkpoint directory cannot be null or empty");
            }
            this.checkpointDirectory = checkpointDirectory;
            return this;
        }

        public Builder checkpointMaxAgeMS(long checkpointMaxAgeMS)
        {
            if (checkpointMaxAgeMS < 1)
            {
                throw new IllegalArgumentException("Checkpoint max age must be positive");
            }
            this.checkpointMaxAgeMS = checkpointMaxAgeMS;
            return this;
        }

        public Builder checkpointIntervalMS(long checkpointIntervalMS)
        {
            if (checkpointIntervalMS < 10)
            {
                throw new IllegalArgumentException("Checkpoint interval must be at least 10 ms");
            }
            this.checkpointIntervalMS = checkpointIntervalMS;
            return this;
        }

        public Builder progressIntervalMS(long progressIntervalMS)
        {
            if (progressIntervalMS < 0)
            {
                throw new IllegalArgumentException("Progress interval cannot be negative");
            }
            this.progressIntervalMS = progressIntervalMS;
            return this;
        }

        public Builder resumePartialSegments(boolean resumePartialSegments)
        {
            this.resumePartialSegments = resumePartialSegments;
            return this;
        }

        public Builder maxPlanRestarts(int maxPlanRestarts)
        {
            if (maxPlanRestarts < 0)
            {
                throw new IllegalArgumentException("Max plan restarts cannot be negative");
            }
            this.maxPlanRestarts = maxPlanRestarts;
            return this;
        }

        public Builder userAgent(String userAgent)
        {
            if (userAgent == null || userAgent.trim().isEmpty())
            {
                throw new IllegalArgumentException("User agent cannot be null or empty");
            }
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Convenience method to set the minimum segment size in megabytes
         */
        public Builder minSegmentSizeMB(int megabytes)
        {
            return minSegmentSize(megabytes * 1024L * 1024L);
        }

        /**
         * Convenience method to set timeouts in seconds
         */
        public Builder timeoutsInSeconds(int seconds)
        {
            int milliseconds = seconds * 1000;
            connectionTimeout(milliseconds);
            readTimeout(milliseconds);
            return this;
        }

        public DownloadConfig build()
        {
            if (maxRetryDelayMS < retryDelayMS)
            {
                throw new IllegalArgumentException("Max retry delay cannot be less than the initial retry delay");
            }
            return new DownloadConfig(this);
        }
    }
}
