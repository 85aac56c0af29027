package com.hunkyhsu.bufferpool.config;

import com.hunkyhsu.bufferpool.storage.Page;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Buffer pool settings.
 *
 * <pre>
 * bufferpool.pool-size = 64      # number of frames
 * bufferpool.page-size = 4096    # bytes per page
 * bufferpool.replacer  = LRU     # LRU | CLOCK
 * </pre>
 */
@Getter
@Builder
@ToString
public class BufferPoolConfig {
    private static final Logger logger = LoggerFactory.getLogger(BufferPoolConfig.class);

    public static final String DEFAULT_RESOURCE = "bufferpool.properties";
    public static final String POOL_SIZE_KEY = "bufferpool.pool-size";
    public static final String PAGE_SIZE_KEY = "bufferpool.page-size";
    public static final String REPLACER_KEY = "bufferpool.replacer";

    public static final int DEFAULT_POOL_SIZE = 64;

    @Builder.Default
    private final int poolSize = DEFAULT_POOL_SIZE;

    @Builder.Default
    private final int pageSize = Page.DEFAULT_PAGE_SIZE;

    @Builder.Default
    private final ReplacerType replacerType = ReplacerType.LRU;

    public static BufferPoolConfig defaults() {
        return BufferPoolConfig.builder().build().validate();
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, falling back to defaults when absent.
     */
    public static BufferPoolConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static BufferPoolConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = BufferPoolConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("Config resource {} not found, using defaults", resource);
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resource, e);
        }
        BufferPoolConfig config = fromProperties(properties);
        logger.info("Loaded {} from {}", config, resource);
        return config;
    }

    public static BufferPoolConfig fromProperties(Properties properties) {
        BufferPoolConfigBuilder builder = BufferPoolConfig.builder();
        String poolSize = properties.getProperty(POOL_SIZE_KEY);
        if (poolSize != null) {
            builder.poolSize(parseInt(POOL_SIZE_KEY, poolSize));
        }
        String pageSize = properties.getProperty(PAGE_SIZE_KEY);
        if (pageSize != null) {
            builder.pageSize(parseInt(PAGE_SIZE_KEY, pageSize));
        }
        String replacer = properties.getProperty(REPLACER_KEY);
        if (replacer != null) {
            try {
                builder.replacerType(ReplacerType.valueOf(replacer.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        String.format("Unknown %s: %s", REPLACER_KEY, replacer), e);
            }
        }
        return builder.build().validate();
    }

    public BufferPoolConfig validate() {
        if (poolSize <= 0) {
            throw new IllegalArgumentException(POOL_SIZE_KEY + " must be positive: " + poolSize);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException(PAGE_SIZE_KEY + " must be positive: " + pageSize);
        }
        if (replacerType == null) {
            throw new IllegalArgumentException(REPLACER_KEY + " must be set");
        }
        return this;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid %s: %s", key, value), e);
        }
    }
}
