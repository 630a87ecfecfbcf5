package com.libragraph.odfpack.util.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Random-access binary data backed by RAM, a temp file, or a caller's channel.
 *
 * Implements SeekableByteChannel so it can be handed directly to archive readers.
 * Used as the in-memory form of a package: a source that may only be read once
 * is copied into one of these, and zip output can be written into a {@link Buffer}.
 */
public abstract class BinaryData implements SeekableByteChannel {

    /** Largest size {@link #toByteArray()} will materialize. */
    private static final long MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     * Closing the result closes the channel.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel, true);
    }

    /**
     * Wraps a byte array without copying it.
     */
    public static BinaryData wrap(byte[] bytes) {
        return new RamBuffer(bytes);
    }

    /**
     * Returns a view of {@code data} whose {@link #close()} leaves the underlying
     * channel open. For handing caller-owned data to readers that close what they read.
     */
    public static BinaryData unclosable(SeekableByteChannel data) {
        return new WrappedBinaryData(data, false);
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newInputStream() wrapper.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Reads the first N bytes as a header (for format detection).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);
        int toRead = (int) Math.min(limit, size());

        try {
            long originalPos = position();
            position(0);

            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            while (buffer.hasRemaining()) {
                if (read(buffer) == -1) break;
            }

            position(originalPos);

            buffer.flip();
            byte[] header = new byte[buffer.remaining()];
            buffer.get(header);
            return header;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }

    /**
     * Copies the whole content into a new array. Does not advance the position.
     *
     * @throws IllegalStateException if the data is too large for a single array
     */
    public byte[] toByteArray() {
        long size = size();
        if (size > MAX_ARRAY_SIZE) {
            throw new IllegalStateException("Binary data too large for an array: " + size + " bytes");
        }
        try {
            long originalPos = position();
            position(0);

            ByteBuffer buffer = ByteBuffer.allocate((int) size);
            while (buffer.hasRemaining()) {
                if (read(buffer) == -1) break;
            }

            position(originalPos);
            return buffer.array();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy binary data", e);
        }
    }
}
