package com.libragraph.odfpack.util.buffer;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class RamBufferTest {

    @Test
    void shouldReadAndWrite() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));

        assertThat(buf.size()).isEqualTo(5);

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(5);
        buf.read(dst);
        dst.flip();
        assertThat(new String(dst.array(), 0, dst.remaining())).isEqualTo("Hello");
    }

    @Test
    void shouldTruncate() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello, World!".getBytes()));

        assertThat(buf.size()).isEqualTo(13);

        buf.truncate(5);
        assertThat(buf.size()).isEqualTo(5);
        assertThat(buf.position()).isEqualTo(5);
        assertThat(new String(buf.toByteArray())).isEqualTo("Hello");
    }

    @Test
    void shouldGrowAutomatically() throws Exception {
        Buffer buf = Buffer.allocate(4);
        byte[] data = "Hello, this is longer than 4 bytes".getBytes();
        buf.write(ByteBuffer.wrap(data));

        assertThat(buf.size()).isEqualTo(data.length);
        assertThat(buf.toByteArray()).isEqualTo(data);
    }

    @Test
    void shouldGrowFromZeroCapacity() throws Exception {
        Buffer buf = Buffer.allocate(0);
        buf.write(ByteBuffer.wrap("grown".getBytes()));

        assertThat(new String(buf.toByteArray())).isEqualTo("grown");
    }

    @Test
    void shouldReturnEofWhenExhausted() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("AB".getBytes()));

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(2);
        assertThat(buf.read(dst)).isEqualTo(2);

        dst.clear();
        assertThat(buf.read(dst)).isEqualTo(-1);
    }

    @Test
    void shouldWrapArrayWithoutCopying() throws Exception {
        byte[] data = "shared".getBytes();
        RamBuffer buf = new RamBuffer(data);

        assertThat(buf.size()).isEqualTo(6);
        data[0] = 'S';
        assertThat(new String(buf.toByteArray())).isEqualTo("Shared");
    }

    @Test
    void shouldCopyStreamAndRewind() throws Exception {
        Buffer buf = Buffer.copyOf(new ByteArrayInputStream("from a stream".getBytes()), -1);

        assertThat(buf).isInstanceOf(RamBuffer.class);
        assertThat(buf.position()).isZero();
        assertThat(new String(buf.toByteArray())).isEqualTo("from a stream");
    }

    @Test
    void shouldRejectNegativePosition() {
        Buffer buf = Buffer.allocate(8);
        assertThatIllegalArgumentException().isThrownBy(() -> buf.position(-1));
    }
}
