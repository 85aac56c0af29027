package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU Replacer - 基于 LRU 算法的页面替换器
 *
 * 核心设计：
 * - 使用 LinkedHashMap（accessOrder=true）实现 LRU
 * - 只管理 pinCount == 0 的 Frame（可淘汰的 Frame）
 * - 不加锁：由 BufferPoolManager 的全局锁保护
 *
 * 数据结构：
 * - LinkedHashMap 的迭代顺序 = 访问顺序（最近访问的在末尾）
 * - 最久未访问的 Frame 在头部，最先被淘汰
 *
 * @author hunkyhsu
 */
public class LRUReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(LRUReplacer.class);

    private final LinkedHashMap<FrameId, Boolean> lruMap;

    public LRUReplacer(int capacity) {
        // 每次 get/put 都会将元素移到末尾
        this.lruMap = new LinkedHashMap<>(capacity, 0.75f, true);
        logger.info("LRU Replacer initialized with capacity {}", capacity);
    }

    /**
     * 返回 LinkedHashMap 的第一个元素（最久未使用）
     */
    @Override
    public Optional<FrameId> victim() {
        Iterator<Map.Entry<FrameId, Boolean>> it = lruMap.entrySet().iterator();
        if (it.hasNext()) {
            FrameId frameId = it.next().getKey();
            it.remove();
            logger.debug("Victim selected: frameId={}", frameId.getIndex());
            return Optional.of(frameId);
        }
        logger.debug("No victim available (all frames are pinned)");
        return Optional.empty();
    }

    @Override
    public void pin(FrameId frameId) {
        lruMap.remove(frameId);
        logger.trace("Frame {} pinned (removed from LRU)", frameId.getIndex());
    }

    /**
     * 加入 LRU 列表末尾；已在列表中的 Frame 只会被移动，不会重复
     */
    @Override
    public void unpin(FrameId frameId) {
        lruMap.put(frameId, Boolean.TRUE);
        logger.trace("Frame {} unpinned (added to LRU)", frameId.getIndex());
    }

    @Override
    public int size() {
        return lruMap.size();
    }
}
