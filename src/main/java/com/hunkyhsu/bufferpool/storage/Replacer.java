package com.hunkyhsu.bufferpool.storage;

import java.util.Optional;

/**
 * Replacer - 页面替换策略接口
 *
 * 职责：
 * - 决定当 BufferPool 满时应该淘汰哪个 Frame
 * - 管理可淘汰的 Frame 列表（pinCount == 0 的 Frame）
 *
 * 实现类本身不加锁，只能在 BufferPoolManager 的全局锁内调用。
 *
 * @author hunkyhsu
 * @see LRUReplacer
 * @see ClockReplacer
 */
public interface Replacer {

    /**
     * 选择一个 Frame 进行淘汰（Evict），并将其移出候选集合
     *
     * @return 被淘汰的 Frame，如果所有 Frame 都被 pin 住则返回 empty
     */
    Optional<FrameId> victim();

    /**
     * 将 Frame 标记为不可淘汰（被 pin 住）
     *
     * 当 Page 的 pinCount > 0 时调用，表示该 Page 正在被使用
     *
     * @param frameId Frame ID
     */
    void pin(FrameId frameId);

    /**
     * 将 Frame 标记为可淘汰（被 unpin）
     *
     * 当 Page 的 pinCount == 0 时调用，表示该 Page 可以被淘汰
     *
     * @param frameId Frame ID
     */
    void unpin(FrameId frameId);

    /**
     * 获取当前可淘汰的 Frame 数量
     *
     * @return 可淘汰的 Frame 数量
     */
    int size();

}
