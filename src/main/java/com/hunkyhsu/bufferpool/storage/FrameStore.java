package com.hunkyhsu.bufferpool.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity arena of frames, allocated once and addressed by {@link FrameId}.
 */
public class FrameStore {

    private final Page[] pages;

    private final List<FrameId> frameIds;

    public FrameStore(int capacity, int pageSize) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Frame store capacity must be positive: " + capacity);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pages = new Page[capacity];
        List<FrameId> ids = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) {
            FrameId frameId = FrameId.of(i);
            pages[i] = new Page(frameId, pageSize);
            ids.add(frameId);
        }
        this.frameIds = Collections.unmodifiableList(ids);
    }

    public Page get(FrameId frameId) {
        int index = frameId.getIndex();
        if (index < 0 || index >= pages.length) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (capacity: %d)", index, pages.length));
        }
        return pages[index];
    }

    public List<FrameId> frameIds() {
        return frameIds;
    }
}
