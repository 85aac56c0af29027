package com.hunkyhsu.bufferpool.config;

import com.hunkyhsu.bufferpool.storage.ClockReplacer;
import com.hunkyhsu.bufferpool.storage.LRUReplacer;
import com.hunkyhsu.bufferpool.storage.Page;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class BufferPoolConfigTest {

    @Test
    @DisplayName("测试：默认配置")
    void testDefaults() {
        BufferPoolConfig config = BufferPoolConfig.defaults();
        assertEquals(BufferPoolConfig.DEFAULT_POOL_SIZE, config.getPoolSize());
        assertEquals(Page.DEFAULT_PAGE_SIZE, config.getPageSize());
        assertEquals(ReplacerType.LRU, config.getReplacerType());
    }

    @Test
    @DisplayName("测试：从 classpath 加载配置")
    void testLoadFromClasspath() {
        BufferPoolConfig config = BufferPoolConfig.load("bufferpool-test.properties");
        assertEquals(8, config.getPoolSize());
        assertEquals(4096, config.getPageSize());
        assertEquals(ReplacerType.CLOCK, config.getReplacerType());

        BufferPoolConfig missing = BufferPoolConfig.load("no-such-config.properties");
        assertEquals(BufferPoolConfig.DEFAULT_POOL_SIZE, missing.getPoolSize());
    }

    @Test
    @DisplayName("测试：Properties 部分覆盖")
    void testFromPropertiesPartialOverride() {
        Properties properties = new Properties();
        properties.setProperty(BufferPoolConfig.POOL_SIZE_KEY, " 16 ");
        properties.setProperty(BufferPoolConfig.REPLACER_KEY, "clock");

        BufferPoolConfig config = BufferPoolConfig.fromProperties(properties);
        assertEquals(16, config.getPoolSize());
        assertEquals(Page.DEFAULT_PAGE_SIZE, config.getPageSize());
        assertInstanceOf(ClockReplacer.class, config.getReplacerType().create(config.getPoolSize()));
        assertInstanceOf(LRUReplacer.class, ReplacerType.LRU.create(4));
    }

    @Test
    @DisplayName("测试：非法配置")
    void testInvalidValues() {
        Properties badSize = new Properties();
        badSize.setProperty(BufferPoolConfig.POOL_SIZE_KEY, "0");
        assertThrows(IllegalArgumentException.class, () -> BufferPoolConfig.fromProperties(badSize));

        Properties notANumber = new Properties();
        notANumber.setProperty(BufferPoolConfig.PAGE_SIZE_KEY, "4k");
        assertThrows(IllegalArgumentException.class, () -> BufferPoolConfig.fromProperties(notANumber));

        Properties badReplacer = new Properties();
        badReplacer.setProperty(BufferPoolConfig.REPLACER_KEY, "random");
        assertThrows(IllegalArgumentException.class, () -> BufferPoolConfig.fromProperties(badReplacer));
    }
}
