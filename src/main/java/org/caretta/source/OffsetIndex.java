package org.caretta.source;

/**
 * Sorted byte offsets of every {@code '\n'} in a source text, used for binary-search
 * line lookup. Offsets are stored in the narrowest unsigned element width that can
 * represent the text length, which keeps the index small for the many short buffers
 * a front end typically opens. Callers only see the width-erased accessors.
 */
public sealed interface OffsetIndex permits OffsetIndex.U8, OffsetIndex.U16, OffsetIndex.U32, OffsetIndex.U64 {

    /**
     * The element width of an index.
     */
    enum Width {
        /** Unsigned 8-bit offsets. */
        BITS_8(0xFFL),
        /** Unsigned 16-bit offsets. */
        BITS_16(0xFFFFL),
        /** Unsigned 32-bit offsets. */
        BITS_32(0xFFFF_FFFFL),
        /** 64-bit offsets. */
        BITS_64(Long.MAX_VALUE);

        private final long maxValue;

        Width(long maxValue) {
            this.maxValue = maxValue;
        }

        public long maxValue() {
            return maxValue;
        }

        /**
         * Selects the smallest width whose maximum value is at least {@code length}.
         * @param length The buffer length in bytes.
         * @return The width to use.
         */
        public static Width forLength(long length) {
            if (length < 0) {
                throw new IllegalArgumentException("Length must not be negative: " + length);
            }
            for (Width width : values()) {
                if (length <= width.maxValue) {
                    return width;
                }
            }
            return BITS_64;
        }
    }

    /**
     * @return The number of newline offsets.
     */
    int count();

    /**
     * @param index A position in {@code [0, count())}.
     * @return The byte offset of the {@code index}-th newline.
     */
    long offsetAt(int index);

    Width width();

    /**
     * Finds the first newline whose offset is not less than {@code offset}, that is the
     * newline ending the line {@code offset} is on (or {@code offset} itself if it is a
     * newline).
     *
     * @param offset A byte offset.
     * @return The index of that newline, or {@link #count()} if there is none.
     */
    default int lowerBound(long offset) {
        int low = 0;
        int high = count();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (offsetAt(mid) < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Scans the text and builds an index in the width chosen for its length.
     * @param text The source text.
     * @return The index.
     */
    static OffsetIndex build(SourceText text) {
        byte[] bytes = text.bytes();
        int count = 0;
        for (byte b : bytes) {
            if (b == '\n') count++;
        }

        Width width = Width.forLength(bytes.length);
        return switch (width) {
            case BITS_8 -> {
                byte[] offsets = new byte[count];
                for (int i = 0, n = 0; i < bytes.length; i++) {
                    if (bytes[i] == '\n') offsets[n++] = (byte) i;
                }
                yield new U8(offsets);
            }
            case BITS_16 -> {
                short[] offsets = new short[count];
                for (int i = 0, n = 0; i < bytes.length; i++) {
                    if (bytes[i] == '\n') offsets[n++] = (short) i;
                }
                yield new U16(offsets);
            }
            case BITS_32 -> {
                int[] offsets = new int[count];
                for (int i = 0, n = 0; i < bytes.length; i++) {
                    if (bytes[i] == '\n') offsets[n++] = i;
                }
                yield new U32(offsets);
            }
            case BITS_64 -> {
                long[] offsets = new long[count];
                for (int i = 0, n = 0; i < bytes.length; i++) {
                    if (bytes[i] == '\n') offsets[n++] = i;
                }
                yield new U64(offsets);
            }
        };
    }

    /** Index with unsigned 8-bit elements. */
    final class U8 implements OffsetIndex {
        private final byte[] offsets;

        private U8(byte[] offsets) {
            this.offsets = offsets;
        }

        @Override
        public int count() {
            return offsets.length;
        }

        @Override
        public long offsetAt(int index) {
            return Byte.toUnsignedInt(offsets[index]);
        }

        @Override
        public Width width() {
            return Width.BITS_8;
        }
    }

    /** Index with unsigned 16-bit elements. */
    final class U16 implements OffsetIndex {
        private final short[] offsets;

        private U16(short[] offsets) {
            this.offsets = offsets;
        }

        @Override
        public int count() {
            return offsets.length;
        }

        @Override
        public long offsetAt(int index) {
            return Short.toUnsignedInt(offsets[index]);
        }

        @Override
        public Width width() {
            return Width.BITS_16;
        }
    }

    /** Index with unsigned 32-bit elements. */
    final class U32 implements OffsetIndex {
        private final int[] offsets;

        private U32(int[] offsets) {
            this.offsets = offsets;
        }

        @Override
        public int count() {
            return offsets.length;
        }

        @Override
        public long offsetAt(int index) {
            return Integer.toUnsignedLong(offsets[index]);
        }

        @Override
        public Width width() {
            return Width.BITS_32;
        }
    }

    /** Index with 64-bit elements. */
    final class U64 implements OffsetIndex {
        private final long[] offsets;

        private U64(long[] offsets) {
            this.offsets = offsets;
        }

        @Override
        public int count() {
            return offsets.length;
        }

        @Override
        public long offsetAt(int index) {
            return offsets[index];
        }

        @Override
        public Width width() {
            return Width.BITS_64;
        }
    }
}
