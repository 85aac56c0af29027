package com.hunkyhsu.bufferpool.storage;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * In-memory frame hosting the bytes of one page.
 *
 * <p>Callers may read and write {@link #getPageData()} only while they hold a pin on the page.
 * All metadata changes go through {@link BufferPoolManager}.
 */
@Getter
public class Page {
    public static final int DEFAULT_PAGE_SIZE = 4096; // 4kb

    private final FrameId frameId;

    @Setter(AccessLevel.PACKAGE)
    private PageId pageId;

    private final ByteBuffer pageData;

    @Setter(AccessLevel.PACKAGE)
    private boolean dirty = false;

    private int pinCount = 0;

    Page(FrameId frameId, int pageSize) {
        this.frameId = frameId;
        this.pageData = ByteBuffer.allocate(pageSize);
        resetMemory();
    }

    /**
     * Zero the buffer and drop identity, dirty flag and pins.
     */
    /**
     * 同一个 Page 的所有 pin 持有者共享这个 ByteBuffer，fetchPage 命中时会 rewind()。
     * 多个调用方同时持有 pin 时，应使用绝对位置的 get(int)/put(int, ...) 或自己的 duplicate()，
     * 不要依赖 position。
     */
    public ByteBuffer getPageData() {
        return pageData;
    }

    void resetMemory() {
        this.pageId = null;
        this.dirty = false;
        this.pinCount = 0;
        Arrays.fill(this.pageData.array(), (byte) 0);
        this.pageData.clear();
    }

    /**
     * increase the pinCount
     */
    void pin() {
        this.pinCount++;
    }

    /**
     * decrease the pinCount
     */
    void unpin() {
        if (this.pinCount > 0) {
            this.pinCount--;
        }
    }

    void resetPinCount() {
        this.pinCount = 0;
    }

    public int getPageSize() {
        return pageData.capacity();
    }
}
