package com.hunkyhsu.bufferpool.storage;

import com.hunkyhsu.bufferpool.config.BufferPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * BufferPoolManager - 缓冲池管理器
 *
 * 所有公开操作都在同一把全局锁内执行（包括磁盘 IO）。
 * 返回的 Page 只在对应的 unpinPage 之前有效。
 */
public class BufferPoolManager implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BufferPoolManager.class);

    private final int poolSize;

    private final FrameStore frames;

    private final ConcurrentHashMap<PageId, FrameId> pageTable;

    private final LinkedBlockingQueue<FrameId> freeList;

    private final Replacer replacer;

    private final DiskManager diskManager;

    private final ReentrantLock globalLock;

    public BufferPoolManager(int poolSize, DiskManager diskManager) {
        this(poolSize, diskManager, new LRUReplacer(poolSize));
    }

    public BufferPoolManager(BufferPoolConfig config, DiskManager diskManager) {
        this(checkPageSize(config, diskManager), diskManager,
                config.getReplacerType().create(config.getPoolSize()));
    }

    public BufferPoolManager(int poolSize, DiskManager diskManager, Replacer replacer) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
        this.frames = new FrameStore(poolSize, diskManager.getPageSize());
        this.pageTable = new ConcurrentHashMap<>(poolSize);
        this.freeList = new LinkedBlockingQueue<>(poolSize);
        this.replacer = replacer;
        this.diskManager = diskManager;
        this.globalLock = new ReentrantLock();

        for (FrameId frameId : frames.frameIds()) {
            freeList.offer(frameId);
        }

        logger.info("BufferPoolManager initialized: poolSize={}, pageSize={}, replacer={}",
                poolSize, diskManager.getPageSize(), replacer.getClass().getSimpleName());
    }

    // Get page (auto-pin), empty when all frames are pinned
    public Optional<Page> fetchPage(PageId pageId) throws IOException {
        checkPageId(pageId);
        globalLock.lock();
        try {
            // case 1. 检查 Page 是否在内存中
            FrameId hit = pageTable.get(pageId);
            if (hit != null) {
                Page page = frames.get(hit);
                page.pin();
                replacer.pin(hit);
                // 重置 ByteBuffer position 到开头，方便用户读取
                page.getPageData().rewind();
                logger.debug("Page {} hit in buffer pool (frameId={}, pinCount={})",
                        pageId, hit.getIndex(), page.getPinCount());
                return Optional.of(page);
            }

            // case 2. Page 不在内存，需要从磁盘加载
            Optional<FrameId> victim = findVictimFrame();
            if (victim.isEmpty()) {
                logger.warn("Cannot fetch page {}: all frames are pinned", pageId);
                return Optional.empty();
            }
            FrameId frameId = victim.get();
            Page page = frames.get(frameId);
            try {
                repurposeFrame(frameId, page, pageId);
            } catch (IOException | RuntimeException e) {
                restoreVictim(frameId, page);
                throw e;
            }
            try {
                diskManager.readPage(pageId.getFileId(), pageId.getPageNo(), page.getPageData());
            } catch (IOException | RuntimeException e) {
                discardFrame(frameId, page);
                throw e;
            }
            page.getPageData().rewind();

            page.pin();
            replacer.pin(frameId);
            logger.debug("Page {} loaded from disk (frameId={})", pageId, frameId.getIndex());
            return Optional.of(page);
        } finally {
            globalLock.unlock();
        }
    }

    // release page; isDirty 只会置位，不会清除
    public boolean unpinPage(PageId pageId, boolean isDirty) {
        globalLock.lock();
        try {
            FrameId frameId = pageId == null ? null : pageTable.get(pageId);
            if (frameId == null) {
                logger.warn("Attempted to unpin non-resident page {}", pageId);
                return false;
            }
            Page page = frames.get(frameId);
            if (page.getPinCount() == 0) {
                logger.warn("Attempted to unpin page {} with pinCount=0", pageId);
                return false;
            }
            if (isDirty) {
                page.setDirty(true);
            }
            page.unpin();
            if (page.getPinCount() == 0) {
                replacer.unpin(frameId);
                logger.debug("Page {} unpinned (frameId={}, pinCount=0, evictable)",
                        pageId, frameId.getIndex());
            } else {
                logger.debug("Page {} unpinned (frameId={}, pinCount={})",
                        pageId, frameId.getIndex(), page.getPinCount());
            }
            return true;
        } finally {
            globalLock.unlock();
        }
    }

    // Manual Flush: 不管是否 dirty 或 pin 都写盘
    public boolean flushPage(PageId pageId) throws IOException {
        globalLock.lock();
        try {
            if (pageId == null || !pageId.isValid()) {
                logger.warn("Attempted to flush invalid page {}", pageId);
                return false;
            }
            FrameId frameId = pageTable.get(pageId);
            if (frameId == null) {
                logger.warn("Attempted to flush non-resident page {}", pageId);
                return false;
            }
            writeBack(frames.get(frameId));
            logger.debug("Page {} flushed to disk", pageId);
            return true;
        } finally {
            globalLock.unlock();
        }
    }

    public int flushAllPages() throws IOException {
        globalLock.lock();
        try {
            int flushed = 0;
            for (PageId pageId : new ArrayList<>(pageTable.keySet())) {
                if (flushPage(pageId)) {
                    flushed++;
                }
            }
            logger.info("Flushed {} resident pages to disk", flushed);
            return flushed;
        } finally {
            globalLock.unlock();
        }
    }

    // 只刷某个文件的 Page
    public int flushAllPages(int fileId) throws IOException {
        globalLock.lock();
        try {
            int flushed = 0;
            for (Map.Entry<PageId, FrameId> entry : new ArrayList<>(pageTable.entrySet())) {
                if (entry.getKey().getFileId() != fileId) {
                    continue;
                }
                writeBack(frames.get(entry.getValue()));
                flushed++;
            }
            logger.info("Flushed {} resident pages of file {} to disk", flushed, fileId);
            return flushed;
        } finally {
            globalLock.unlock();
        }
    }

    public Optional<Page> newPage(int fileId) throws IOException {
        globalLock.lock();
        try {
            // 1. 先找一个可用的 Frame，失败时不分配磁盘页
            Optional<FrameId> victim = findVictimFrame();
            if (victim.isEmpty()) {
                logger.warn("Cannot create new page in file {}: all frames are pinned", fileId);
                return Optional.empty();
            }
            FrameId frameId = victim.get();
            Page page = frames.get(frameId);

            // 2. 分配新 Page ID
            int pageNo;
            try {
                pageNo = diskManager.allocatePage(fileId);
            } catch (IOException | RuntimeException e) {
                restoreVictim(frameId, page);
                throw e;
            }
            PageId newPageId = new PageId(fileId, pageNo);

            // 3. 旧 Page 写回，清零后装入新 Page
            try {
                repurposeFrame(frameId, page, newPageId);
            } catch (IOException | RuntimeException e) {
                restoreVictim(frameId, page);
                throw e;
            }
            page.pin();
            replacer.pin(frameId);

            logger.info("Created new page {} (frameId={})", newPageId, frameId.getIndex());
            return Optional.of(page);
        } finally {
            globalLock.unlock();
        }
    }

    // 不在内存中视为删除成功
    public boolean deletePage(PageId pageId) throws IOException {
        globalLock.lock();
        try {
            FrameId frameId = pageId == null ? null : pageTable.get(pageId);
            if (frameId == null) {
                logger.debug("Page {} not resident, nothing to delete", pageId);
                return true;
            }
            Page page = frames.get(frameId);

            // 如果 Page 正在使用，不能删除
            if (page.getPinCount() != 0) {
                logger.warn("Cannot delete page {} (pinCount={})", pageId, page.getPinCount());
                return false;
            }
            if (page.isDirty()) {
                writeBack(page);
            }
            // 从 PageTable 和 Replacer 中移除，归还 free list
            pageTable.remove(pageId);
            replacer.pin(frameId);
            page.resetMemory();
            freeList.offer(frameId);

            logger.info("Deleted page {} (frameId={})", pageId, frameId.getIndex());
            return true;
        } finally {
            globalLock.unlock();
        }
    }

    public boolean containsPage(PageId pageId) {
        globalLock.lock();
        try {
            return pageId != null && pageTable.containsKey(pageId);
        } finally {
            globalLock.unlock();
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getFreeFrameCount() {
        globalLock.lock();
        try {
            return freeList.size();
        } finally {
            globalLock.unlock();
        }
    }

    // 被淘汰的 Frame 在这里移出 PageTable，但旧数据和 dirty 保留到 repurposeFrame 写回
    private Optional<FrameId> findVictimFrame() {
        // 1. 优先从空闲列表获取
        FrameId frameId = freeList.poll();
        if (frameId != null) {
            logger.trace("Allocated free frame {}", frameId.getIndex());
            return Optional.of(frameId);
        }

        // 2. 没有空闲 Frame，通过 Replacer 淘汰
        Optional<FrameId> victim = replacer.victim();
        if (victim.isPresent()) {
            frameId = victim.get();
            Page page = frames.get(frameId);
            if (page.getPinCount() != 0) {
                throw new IllegalStateException(String.format(
                        "Replacer selected frame %d which is still pinned (pinCount=%d)",
                        frameId.getIndex(), page.getPinCount()));
            }
            pageTable.remove(page.getPageId(), frameId);
            logger.trace("Evicted page {} from frame {}", page.getPageId(), frameId.getIndex());
            return victim;
        }

        // 3. 所有 Page 都被 pin 住，无法淘汰
        return Optional.empty();
    }

    // 脏页写回 -> 清零 -> 绑定新 PageId
    private void repurposeFrame(FrameId frameId, Page page, PageId newPageId) throws IOException {
        if (page.getPinCount() != 0) {
            throw new IllegalStateException(String.format(
                    "Cannot repurpose frame %d holding pinned page %s",
                    frameId.getIndex(), page.getPageId()));
        }
        PageId oldPageId = page.getPageId();
        if (oldPageId != null && page.isDirty()) {
            writeBack(page);
            logger.debug("Flushed dirty page {} before eviction", oldPageId);
        }
        page.resetPinCount();
        if (oldPageId != null) {
            pageTable.remove(oldPageId, frameId);
        }
        page.resetMemory();
        page.setPageId(newPageId);
        pageTable.put(newPageId, frameId);
    }

    private void writeBack(Page page) throws IOException {
        PageId pageId = page.getPageId();
        diskManager.writePage(pageId.getFileId(), pageId.getPageNo(), page.getPageData());
        page.setDirty(false);
    }

    // 旧 Page 还完整地留在 Frame 里时，把 victim 还回去
    private void restoreVictim(FrameId frameId, Page page) {
        if (page.getPageId() == null) {
            freeList.offer(frameId);
        } else {
            pageTable.put(page.getPageId(), frameId);
            if (page.getPinCount() == 0) {
                replacer.unpin(frameId);
            }
        }
    }

    private void discardFrame(FrameId frameId, Page page) {
        if (page.getPageId() != null) {
            pageTable.remove(page.getPageId(), frameId);
        }
        page.resetMemory();
        freeList.offer(frameId);
        logger.warn("Load into frame {} failed, frame returned to free list", frameId.getIndex());
    }

    // 配置的 pageSize 必须和 DiskManager 一致，在分配 Frame 之前检查
    private static int checkPageSize(BufferPoolConfig config, DiskManager diskManager) {
        if (config.getPageSize() != diskManager.getPageSize()) {
            throw new IllegalArgumentException(String.format(
                    "Configured pageSize %d does not match disk pageSize %d",
                    config.getPageSize(), diskManager.getPageSize()));
        }
        return config.getPoolSize();
    }

    private static void checkPageId(PageId pageId) {
        if (pageId == null || !pageId.isValid()) {
            throw new IllegalArgumentException("Invalid pageId: " + pageId);
        }
    }

    public String getStats() {
        globalLock.lock();
        try {
            int dirtyPages = 0;
            int pinnedPages = 0;
            List<FrameId> frameIds = frames.frameIds();
            for (FrameId frameId : frameIds) {
                Page page = frames.get(frameId);
                if (page.getPageId() == null) {
                    continue;
                }
                if (page.isDirty()) dirtyPages++;
                if (page.getPinCount() > 0) pinnedPages++;
            }

            return String.format(
                    "BufferPool Stats: poolSize=%d, used=%d, free=%d, dirty=%d, pinned=%d, evictable=%d",
                    poolSize, pageTable.size(), freeList.size(), dirtyPages, pinnedPages, replacer.size()
            );
        } finally {
            globalLock.unlock();
        }
    }

    // DiskManager 由创建者关闭
    @Override
    public void close() throws IOException {
        globalLock.lock();
        try {
            logger.info("Closing BufferPoolManager...");
            flushAllPages();
            logger.info("BufferPoolManager closed. {}", getStats());
        } finally {
            globalLock.unlock();
        }
    }
}
