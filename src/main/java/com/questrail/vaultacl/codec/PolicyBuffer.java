package com.questrail.vaultacl.codec;

import com.questrail.vaultacl.api.PolicyDecodeException;
import com.questrail.vaultacl.api.PublicKey;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * PolicyBuffer
 * -----------------------------------------------------------------------------
 * Little-endian cursor over the fixed binary layout of protocol policy
 * payloads.
 *
 * <pre>
 *   [allowlist length: u32][fixed-size records ...] ... [scalar fields]
 * </pre>
 *
 * {@link Reader} bounds-checks every read and reports short buffers as
 * {@link PolicyDecodeException}; it never throws
 * {@link java.nio.BufferUnderflowException}.
 */
public final class PolicyBuffer
{
    private PolicyBuffer() {}

    public static Reader reader(byte[] data) {
        return new Reader(data);
    }

    public static Writer writer() {
        return new Writer();
    }

    /**
     * Sequential reader with explicit length checks.
     */
    public static final class Reader
    {
        private final ByteBuffer buf;

        private Reader(byte[] data) {
            Objects.requireNonNull(data, "data");
            this.buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        }

        public int remaining() {
            return buf.remaining();
        }

        public int position() {
            return buf.position();
        }

        /**
         * @throws PolicyDecodeException if fewer than {@code bytes} remain
         */
        public void require(long bytes, String what) {
            if (bytes > buf.remaining()) {
                throw new PolicyDecodeException(
                        "Buffer too short for " + what + ": need " + bytes
                                + " bytes at offset " + buf.position()
                                + ", have " + buf.remaining());
            }
        }

        public int u16(String what) {
            require(2, what);
            return buf.getShort() & 0xFFFF;
        }

        /** Reads an unsigned 32-bit value into a {@code long}. */
        public long u32(String what) {
            require(4, what);
            return buf.getInt() & 0xFFFF_FFFFL;
        }

        /** Reads a 32-bit value as raw bits (for domain ids). */
        public int i32(String what) {
            require(4, what);
            return buf.getInt();
        }

        public long u64(String what) {
            require(8, what);
            return buf.getLong();
        }

        public PublicKey key(String what) {
            require(PublicKey.LENGTH, what);
            byte[] raw = new byte[PublicKey.LENGTH];
            buf.get(raw);
            return PublicKey.of(raw);
        }

        /**
         * @throws PolicyDecodeException if unread bytes remain
         */
        public void expectEnd(String what) {
            if (buf.hasRemaining()) {
                throw new PolicyDecodeException(
                        buf.remaining() + " trailing bytes after " + what);
            }
        }
    }

    /**
     * Append-only writer.
     */
    public static final class Writer
    {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);

        private Writer() {}

        public Writer u16(int value) {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("u16 out of range: " + value);
            }
            scratch.clear();
            scratch.putShort((short) value);
            out.write(scratch.array(), 0, 2);
            return this;
        }

        public Writer u32(long value) {
            if (value < 0 || value > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("u32 out of range: " + value);
            }
            return i32((int) value);
        }

        public Writer i32(int value) {
            scratch.clear();
            scratch.putInt(value);
            out.write(scratch.array(), 0, 4);
            return this;
        }

        public Writer u64(long value) {
            scratch.clear();
            scratch.putLong(value);
            out.write(scratch.array(), 0, 8);
            return this;
        }

        public Writer key(PublicKey key) {
            Objects.requireNonNull(key, "key");
            out.writeBytes(key.toBytes());
            return this;
        }

        public byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
