package com.hunkyhsu.bufferpool.config;

import com.hunkyhsu.bufferpool.storage.ClockReplacer;
import com.hunkyhsu.bufferpool.storage.LRUReplacer;
import com.hunkyhsu.bufferpool.storage.Replacer;

/**
 * Eviction policies selectable from configuration.
 */
public enum ReplacerType {
    LRU {
        @Override
        public Replacer create(int capacity) {
            return new LRUReplacer(capacity);
        }
    },
    CLOCK {
        @Override
        public Replacer create(int capacity) {
            return new ClockReplacer(capacity);
        }
    };

    public abstract Replacer create(int capacity);
}
