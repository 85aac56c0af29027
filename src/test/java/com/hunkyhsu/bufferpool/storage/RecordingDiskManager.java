package com.hunkyhsu.bufferpool.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory DiskManager that records every call in order.
 * Pages never written read back as zeros.
 */
class RecordingDiskManager implements DiskManager {

    private final int pageSize;
    private final Map<PageId, byte[]> store = new HashMap<>();
    private final Map<Integer, Integer> nextPageNo = new HashMap<>();
    private final List<String> events = new ArrayList<>();

    private boolean failReads;
    private boolean failWrites;
    private boolean rejectWrites;
    private boolean failAllocations;

    RecordingDiskManager() {
        this(Page.DEFAULT_PAGE_SIZE);
    }

    RecordingDiskManager(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public synchronized void readPage(int fileId, int pageNo, ByteBuffer buffer) throws IOException {
        if (failReads) {
            throw new IOException("injected read failure");
        }
        events.add("read " + fileId + ":" + pageNo);
        byte[] data = store.getOrDefault(new PageId(fileId, pageNo), new byte[pageSize]);
        buffer.clear();
        buffer.put(data);
        buffer.flip();
    }

    @Override
    public synchronized void writePage(int fileId, int pageNo, ByteBuffer buffer) throws IOException {
        if (failWrites) {
            throw new IOException("injected write failure");
        }
        if (rejectWrites) {
            throw new IllegalArgumentException("Unknown fileId: " + fileId);
        }
        events.add("write " + fileId + ":" + pageNo);
        byte[] data = new byte[pageSize];
        ByteBuffer view = buffer.duplicate();
        view.clear();
        view.get(data);
        store.put(new PageId(fileId, pageNo), data);
    }

    @Override
    public synchronized int allocatePage(int fileId) throws IOException {
        if (failAllocations) {
            throw new IOException("injected allocation failure");
        }
        int pageNo = nextPageNo.merge(fileId, 1, Integer::sum) - 1;
        events.add("allocate " + fileId + ":" + pageNo);
        return pageNo;
    }

    @Override
    public void close() {
    }

    synchronized List<String> events() {
        return new ArrayList<>(events);
    }

    synchronized void clearEvents() {
        events.clear();
    }

    synchronized long count(String prefix) {
        return events.stream().filter(e -> e.startsWith(prefix)).count();
    }

    synchronized byte[] stored(PageId pageId) {
        byte[] data = store.get(pageId);
        return data == null ? null : Arrays.copyOf(data, data.length);
    }

    synchronized void putPage(PageId pageId, byte[] content) {
        store.put(pageId, Arrays.copyOf(content, pageSize));
    }

    synchronized void setFailReads(boolean failReads) {
        this.failReads = failReads;
    }

    synchronized void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    synchronized void setRejectWrites(boolean rejectWrites) {
        this.rejectWrites = rejectWrites;
    }

    synchronized void setFailAllocations(boolean failAllocations) {
        this.failAllocations = failAllocations;
    }
}
