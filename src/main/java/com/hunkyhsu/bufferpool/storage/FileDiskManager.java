package com.hunkyhsu.bufferpool.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disk IO Manager backed by one {@link FileChannel} per opened file.
 *
 * <p>Page {@code n} of a file lives at offset {@code n * pageSize}. New pages are appended
 * zero-filled, so page numbers grow monotonically per file.
 */
public class FileDiskManager implements DiskManager {
    private static final Logger logger = LoggerFactory.getLogger(FileDiskManager.class);

    private final int pageSize;

    /**
     * 空 Page Buffer（全 0），allocatePage 时通过 duplicate() 创建独立视图
     */
    private final ByteBuffer emptyPageBuffer;

    private final AtomicInteger nextFileId;

    private final Map<Integer, DbFile> files;

    // 规范化后的绝对路径 -> fileId，同一个物理文件只注册一次
    private final Map<Path, Integer> fileIdsByPath;

    public FileDiskManager() {
        this(Page.DEFAULT_PAGE_SIZE);
    }

    public FileDiskManager(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
        // DirectBuffer 默认就是全 0，无需额外填充
        this.emptyPageBuffer = ByteBuffer.allocateDirect(pageSize);
        this.nextFileId = new AtomicInteger(0);
        this.files = new ConcurrentHashMap<>();
        this.fileIdsByPath = new ConcurrentHashMap<>();
        logger.info("FileDiskManager initialized: pageSize={}", pageSize);
    }

    /**
     * Open (creating if needed) a database file and register it under a new file id.
     * Opening a path that is already open returns its existing file id.
     */
    public synchronized int openFile(Path dbFilePath) throws IOException {
        Path normalized = dbFilePath.toAbsolutePath().normalize();
        Integer existing = fileIdsByPath.get(normalized);
        if (existing != null) {
            logger.debug("File {} already open as fileId={}", normalized, existing);
            return existing;
        }
        // 确保父目录存在（如果有父目录）
        Path parentPath = dbFilePath.toAbsolutePath().getParent();
        if (parentPath != null) {
            File parentDir = parentPath.toFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create directory: " + parentDir.getAbsolutePath());
            }
        }
        FileChannel channel = FileChannel.open(
                dbFilePath,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE
        );
        long fileSize = channel.size();
        if (fileSize % pageSize != 0) {
            logger.warn("File size {} is not a multiple of pageSize {}, file may be corrupted",
                    fileSize, pageSize);
        }
        int fileId = nextFileId.getAndIncrement();
        files.put(fileId, new DbFile(normalized, channel, (int) (fileSize / pageSize)));
        fileIdsByPath.put(normalized, fileId);
        logger.info("Opened file {} as fileId={} ({} pages)",
                dbFilePath.toAbsolutePath(), fileId, fileSize / pageSize);
        return fileId;
    }

    public synchronized void closeFile(int fileId) throws IOException {
        DbFile file = files.remove(fileId);
        if (file == null) {
            logger.warn("Attempted to close unknown fileId {}", fileId);
            return;
        }
        fileIdsByPath.remove(file.path, fileId);
        file.channel.force(true);
        file.channel.close();
        logger.info("Closed fileId={} ({})", fileId, file.path.toAbsolutePath());
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void readPage(int fileId, int pageNo, ByteBuffer buffer) throws IOException {
        DbFile file = checkPage(fileId, pageNo);
        checkBuffer(buffer);
        long offset = (long) pageNo * pageSize;

        buffer.clear();
        int totalBytesRead = 0;
        while (totalBytesRead < pageSize) {
            int bytesRead = file.channel.read(buffer, offset + totalBytesRead);
            if (bytesRead == -1) {
                throw new IOException(String.format(
                        "Unexpected EOF: page %d of file %d is incomplete (expected %d bytes, got %d)",
                        pageNo, fileId, pageSize, totalBytesRead));
            }
            totalBytesRead += bytesRead;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Read page {}:{} from disk (offset={}, bytes={})",
                    fileId, pageNo, offset, totalBytesRead);
        }
        // flip() 将 position 设为 0，limit 设为已读取的字节数
        buffer.flip();
    }

    @Override
    public void writePage(int fileId, int pageNo, ByteBuffer buffer) throws IOException {
        DbFile file = checkPage(fileId, pageNo);
        checkBuffer(buffer);
        long offset = (long) pageNo * pageSize;

        // 独立视图，不改变调用方 buffer 的 position/limit
        ByteBuffer view = buffer.duplicate();
        view.clear();
        try {
            int totalBytesWritten = 0;
            while (view.hasRemaining()) {
                totalBytesWritten += file.channel.write(view, offset + totalBytesWritten);
            }
            file.channel.force(false);
            if (logger.isDebugEnabled()) {
                logger.debug("Wrote page {}:{} to disk (offset={}, bytes={})",
                        fileId, pageNo, offset, totalBytesWritten);
            }
        } catch (IOException e) {
            throw new IOException(String.format(
                    "Failed to write page %d of file %d (offset=%d): %s",
                    pageNo, fileId, offset, e.getMessage()), e);
        }
    }

    // TODO: reuse page numbers released by deleted pages once a free-page map exists
    @Override
    public int allocatePage(int fileId) throws IOException {
        DbFile file = checkFile(fileId);
        int newPageNo = file.numPages.getAndIncrement();
        long offset = (long) newPageNo * pageSize;

        ByteBuffer buffer = emptyPageBuffer.duplicate();
        buffer.clear();
        try {
            while (buffer.hasRemaining()) {
                int written = file.channel.write(buffer, offset + buffer.position());
                if (written == 0) {
                    throw new IOException("Cannot write to disk, possibly full");
                }
            }
            file.channel.force(false);
            if (logger.isDebugEnabled()) {
                logger.debug("Allocated new page {}:{} (total pages: {})",
                        fileId, newPageNo, file.numPages.get());
            }
            return newPageNo;
        } catch (IOException e) {
            file.numPages.decrementAndGet();
            logger.error("Failed to allocate page {}:{}, rolling back numPages to {}",
                    fileId, newPageNo, file.numPages.get());
            throw new IOException(String.format(
                    "Failed to allocate page %d of file %d: %s", newPageNo, fileId, e.getMessage()), e);
        }
    }

    public int getNumPages(int fileId) {
        return checkFile(fileId).numPages.get();
    }

    public long getFileSize(int fileId) throws IOException {
        return checkFile(fileId).channel.size();
    }

    @Override
    public void close() {
        List<Integer> fileIds = new ArrayList<>(files.keySet());
        for (int fileId : fileIds) {
            try {
                closeFile(fileId);
            } catch (IOException e) {
                logger.error("Failed to close fileId={}", fileId, e);
            }
        }
        logger.info("FileDiskManager closed");
    }

    private DbFile checkFile(int fileId) {
        DbFile file = files.get(fileId);
        if (file == null) {
            throw new IllegalArgumentException("Unknown fileId: " + fileId);
        }
        return file;
    }

    private DbFile checkPage(int fileId, int pageNo) {
        DbFile file = checkFile(fileId);
        if (pageNo < 0 || pageNo >= file.numPages.get()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid pageNo: %d (file %d has %d pages)", pageNo, fileId, file.numPages.get()));
        }
        return file;
    }

    private void checkBuffer(ByteBuffer buffer) {
        if (buffer.capacity() != pageSize) {
            throw new IllegalArgumentException(String.format(
                    "Buffer capacity %d does not match pageSize %d", buffer.capacity(), pageSize));
        }
    }

    private static final class DbFile {
        private final Path path;
        private final FileChannel channel;
        private final AtomicInteger numPages;

        private DbFile(Path path, FileChannel channel, int numPages) {
            this.path = path;
            this.channel = channel;
            this.numPages = new AtomicInteger(numPages);
        }
    }
}
