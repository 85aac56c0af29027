package com.hunkyhsu.bufferpool.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Disk IO capability consumed by {@link BufferPoolManager}.
 *
 * <p>All calls are synchronous. Failures surface as {@link IOException} and are never retried
 * by the buffer pool.
 */
public interface DiskManager extends Closeable {

    /**
     * @return size in bytes of every page handled by this manager
     */
    int getPageSize();

    /**
     * Read page {@code pageNo} of file {@code fileId} into {@code buffer}.
     * The buffer must have exactly {@link #getPageSize()} bytes of capacity; it is filled from
     * index 0 and left flipped for reading.
     */
    void readPage(int fileId, int pageNo, ByteBuffer buffer) throws IOException;

    /**
     * Write the whole content of {@code buffer} (index 0 up to its capacity) as page
     * {@code pageNo} of file {@code fileId}.
     */
    void writePage(int fileId, int pageNo, ByteBuffer buffer) throws IOException;

    /**
     * Allocate a fresh page number in file {@code fileId}. Never returns the same number twice
     * for one file.
     */
    int allocatePage(int fileId) throws IOException;
}
