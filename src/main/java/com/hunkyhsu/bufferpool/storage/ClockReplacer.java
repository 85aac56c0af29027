package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Clock Replacer - 时钟（second chance）页面替换器
 *
 * 每个 Frame 有一个 evictable 标志和一个引用位。unpin 时置引用位；
 * victim 时指针转圈，遇到引用位为 1 的 Frame 清零并跳过，遇到引用位为 0 的可淘汰 Frame 即选中。
 * 最多转两圈。
 *
 * @author hunkyhsu
 */
public class ClockReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(ClockReplacer.class);

    private final boolean[] evictable;

    private final boolean[] refBits;

    private int hand;

    private int size;

    public ClockReplacer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Clock capacity must be positive: " + capacity);
        }
        this.evictable = new boolean[capacity];
        this.refBits = new boolean[capacity];
        this.hand = 0;
        this.size = 0;
        logger.info("Clock Replacer initialized with capacity {}", capacity);
    }

    @Override
    public Optional<FrameId> victim() {
        if (size == 0) {
            logger.debug("No victim available (all frames are pinned)");
            return Optional.empty();
        }
        int n = evictable.length;
        for (int counter = 0; counter < n * 2; counter++) {
            int current = hand;
            hand = (hand + 1) % n;
            if (!evictable[current]) {
                continue;
            }
            if (refBits[current]) {
                refBits[current] = false;
                continue;
            }
            evictable[current] = false;
            size--;
            logger.debug("Victim selected: frameId={}", current);
            return Optional.of(FrameId.of(current));
        }
        // unreachable while size > 0: the second sweep finds a cleared reference bit
        throw new IllegalStateException("Clock sweep found no victim with " + size + " evictable frames");
    }

    @Override
    public void pin(FrameId frameId) {
        int index = checkIndex(frameId);
        if (evictable[index]) {
            evictable[index] = false;
            size--;
        }
        refBits[index] = false;
        logger.trace("Frame {} pinned (removed from clock)", index);
    }

    @Override
    public void unpin(FrameId frameId) {
        int index = checkIndex(frameId);
        if (!evictable[index]) {
            evictable[index] = true;
            size++;
        }
        refBits[index] = true;
        logger.trace("Frame {} unpinned (added to clock)", index);
    }

    @Override
    public int size() {
        return size;
    }

    private int checkIndex(FrameId frameId) {
        int index = frameId.getIndex();
        if (index < 0 || index >= evictable.length) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (capacity: %d)", index, evictable.length));
        }
        return index;
    }
}
