package com.hunkyhsu.bufferpool.storage;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Identity of a page on disk: the file it lives in plus its page number inside that file.
 */
@AllArgsConstructor
@Data
public class PageId {
    public static final int INVALID_PAGE_NO = -1;

    private final int fileId;
    private final int pageNo;

    public boolean isValid() {
        return pageNo != INVALID_PAGE_NO;
    }
}
