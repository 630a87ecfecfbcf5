package com.libragraph.odfpack.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * BinaryData implementation that wraps an existing SeekableByteChannel.
 * When not owning, {@link #close()} leaves the wrapped channel open.
 */
class WrappedBinaryData extends BinaryData {

    private final SeekableByteChannel channel;
    private final boolean owning;
    private boolean open = true;

    WrappedBinaryData(SeekableByteChannel channel, boolean owning) {
        this.channel = channel;
        this.owning = owning;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return channel.write(src);
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        channel.position(newPosition);
        return this;
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        channel.truncate(size);
        return this;
    }

    @Override
    public boolean isOpen() {
        return open && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        open = false;
        if (owning) {
            channel.close();
        }
    }
}
