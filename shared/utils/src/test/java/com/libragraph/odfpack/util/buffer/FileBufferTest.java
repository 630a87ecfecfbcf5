package com.libragraph.odfpack.util.buffer;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class FileBufferTest {

    @Test
    void shouldReadAndWrite() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("Hello".getBytes()));
            assertThat(buf.size()).isEqualTo(5);

            buf.position(0);
            ByteBuffer dst = ByteBuffer.allocate(5);
            buf.read(dst);
            dst.flip();
            assertThat(new String(dst.array(), 0, dst.remaining())).isEqualTo("Hello");
        }
    }

    @Test
    void shouldTruncate() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("Hello, World!".getBytes()));
            assertThat(buf.size()).isEqualTo(13);

            buf.truncate(5);
            assertThat(buf.size()).isEqualTo(5);
            assertThat(new String(buf.toByteArray())).isEqualTo("Hello");
        }
    }

    @Test
    void shouldHandleLargeWrite() throws Exception {
        // Write > 4MB to exercise the file backend path
        byte[] chunk = "A".repeat(1024).getBytes();
        int chunks = 5 * 1024; // 5 MB total

        try (FileBuffer buf = new FileBuffer()) {
            for (int i = 0; i < chunks; i++) {
                buf.write(ByteBuffer.wrap(chunk));
            }

            assertThat(buf.size()).isEqualTo((long) chunk.length * chunks);

            buf.position(0);
            ByteBuffer dst = ByteBuffer.allocate(chunk.length);
            buf.read(dst);
            dst.flip();
            byte[] result = new byte[dst.remaining()];
            dst.get(result);
            assertThat(result).isEqualTo(chunk);
        }
    }

    @Test
    void shouldReturnEofWhenExhausted() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("AB".getBytes()));

            buf.position(0);
            ByteBuffer dst = ByteBuffer.allocate(2);
            assertThat(buf.read(dst)).isEqualTo(2);

            dst.clear();
            assertThat(buf.read(dst)).isEqualTo(-1);
        }
    }

    @Test
    void shouldReportClosed() throws Exception {
        FileBuffer buf = new FileBuffer();
        buf.write(ByteBuffer.wrap("temp".getBytes()));
        buf.close();

        assertThat(buf.isOpen()).isFalse();
        buf.close(); // idempotent
    }

    @Test
    void allocateShouldPickFileBufferForLargeSize() throws Exception {
        Buffer small = Buffer.allocate(1024);
        assertThat(small).isInstanceOf(RamBuffer.class);

        try (Buffer large = Buffer.allocate(4 * 1024 * 1024)) {
            assertThat(large).isInstanceOf(FileBuffer.class);
        }
    }
}
