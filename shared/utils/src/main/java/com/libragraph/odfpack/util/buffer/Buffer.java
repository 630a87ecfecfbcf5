package com.libragraph.odfpack.util.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

/**
 * Writable binary data.
 *
 * Factory method allocates appropriate backend (RAM or file)
 * based on size thresholds.
 */
public abstract class Buffer extends BinaryData {

    /** Threshold above which allocate() uses a temp file instead of RAM. */
    static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    private static final int COPY_CHUNK = 8192;

    /**
     * Allocates a buffer of the given size.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) size);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * Drains a stream into a freshly allocated buffer, positioned at 0.
     * The stream is read to its end but not closed.
     *
     * <p>Starts in RAM and moves to a {@link FileBuffer} once the data reaches
     * the file threshold, whatever the size hint said.
     *
     * @param sizeHint expected size, or -1 when unknown
     */
    public static Buffer copyOf(InputStream in, long sizeHint) throws IOException {
        Buffer buffer = allocate(sizeHint < 0 ? COPY_CHUNK : sizeHint);
        try {
            byte[] chunk = new byte[COPY_CHUNK];
            int n;
            while ((n = in.read(chunk)) != -1) {
                if (buffer instanceof RamBuffer && buffer.size() + n >= FILE_THRESHOLD) {
                    buffer = spillToFile(buffer);
                }
                writeFully(buffer, ByteBuffer.wrap(chunk, 0, n));
            }
            buffer.position(0);
            return buffer;
        } catch (IOException | RuntimeException e) {
            buffer.close();
            throw e;
        }
    }

    private static Buffer spillToFile(Buffer ram) throws IOException {
        FileBuffer file = new FileBuffer();
        try {
            writeFully(file, ByteBuffer.wrap(ram.toByteArray()));
        } catch (IOException e) {
            file.close();
            throw e;
        }
        ram.close();
        return file;
    }

    private static void writeFully(Buffer buffer, ByteBuffer src) throws IOException {
        while (src.hasRemaining()) {
            buffer.write(src);
        }
    }
}
