package com.treesync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;

import lombok.Data;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runtime settings of a TreeSync instance.
 *
 * <p>
 * Read from JSON, e.g.:
 *
 * <pre>
 * {
 *   "ringBufferSize": 1024,
 *   "waitStrategy": "BLOCKING",
 *   "errorLogIntervalMillis": 1000,
 *   "expandRootOnAttach": false,
 *   "threadName": "treesync-ui"
 * }
 * </pre>
 *
 * Unknown keys are ignored; absent keys keep their defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TreeSyncConfig {
    private static final Logger log = LogManager.getLogger(TreeSyncConfig.class);

    /** Classpath resource consulted by {@link #load()}. */
    public static final String RESOURCE = "treesync.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Size of the event loop ring buffer; a power of two. */
    private int ringBufferSize = 1024;
    private WaitStrategyType waitStrategy = WaitStrategyType.BLOCKING;
    /** Minimum gap between two logged observer failures. */
    private long errorLogIntervalMillis = 1000;
    private boolean expandRootOnAttach;
    private String threadName = "treesync-ui";

    /** How the event loop thread waits for work. */
    public enum WaitStrategyType {
        /** Lock and condition; lowest CPU use. */
        BLOCKING,
        /** Spin, then yield, then park; a middle ground. */
        SLEEPING,
        /** Spin then yield; lowest latency, burns a core. */
        YIELDING;

        public WaitStrategy create() {
            switch (this) {
                case SLEEPING:
                    return new SleepingWaitStrategy();
                case YIELDING:
                    return new YieldingWaitStrategy();
                case BLOCKING:
                default:
                    return new BlockingWaitStrategy();
            }
        }
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, or returns defaults if the
     * resource is absent.
     *
     * @throws IllegalArgumentException if the resource is malformed or invalid.
     */
    public static TreeSyncConfig load() {
        try (InputStream in = TreeSyncConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return new TreeSyncConfig().validate();
            }
            return MAPPER.readValue(in, TreeSyncConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file.
     *
     * @throws IOException              if the file cannot be read or parsed.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static TreeSyncConfig fromFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON configuration string.
     */
    public static TreeSyncConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, TreeSyncConfig.class).validate();
    }

    /**
     * Checks every value and returns this instance.
     *
     * @throws IllegalArgumentException on the first invalid value.
     */
    public TreeSyncConfig validate() {
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a positive power of 2: " + ringBufferSize);
        if (errorLogIntervalMillis < 0)
            throw new IllegalArgumentException("errorLogIntervalMillis must be >= 0: " + errorLogIntervalMillis);
        if (waitStrategy == null)
            throw new IllegalArgumentException("waitStrategy must be set");
        if (threadName == null || threadName.isBlank())
            throw new IllegalArgumentException("threadName must not be blank");
        return this;
    }
}
