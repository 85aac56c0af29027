package com.hunkyhsu.bufferpool.storage;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Handle of a frame slot inside the {@link FrameStore}.
 * Stable for the lifetime of the pool.
 */
@AllArgsConstructor(staticName = "of")
@Data
public class FrameId {
    private final int index;
}
