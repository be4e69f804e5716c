package Regular.Alphabet;

/**
 * {@link Step} implementations for the supported scalar types.
 * <p>
 * Types narrower than the {@code long} index compute distances by plain subtraction after
 * widening. {@link #LONGS} is as wide as the index, so its distances may not fit and are
 * checked. The two character steps skip the surrogate gap {@code 0xD800..0xDFFF}.
 */
public final class Steps {
    static final int SURROGATE_LOW = 0xD800;
    static final int SURROGATE_HIGH = 0xDFFF;
    static final int SURROGATE_GAP = SURROGATE_HIGH - SURROGATE_LOW + 1; // 2048

    private Steps() {}

    public static final Step<Byte> BYTES = new NarrowIntegral<>("bytes", Byte.MIN_VALUE, Byte.MAX_VALUE) {
        @Override
        Byte box(long value) {
            return (byte) value;
        }
    };

    public static final Step<Short> SHORTS = new NarrowIntegral<>("shorts", Short.MIN_VALUE, Short.MAX_VALUE) {
        @Override
        Short box(long value) {
            return (short) value;
        }
    };

    public static final Step<Integer> INTEGERS = new NarrowIntegral<>("integers", Integer.MIN_VALUE, Integer.MAX_VALUE) {
        @Override
        Integer box(long value) {
            return (int) value;
        }
    };

    public static final Step<Long> LONGS = new Step<>() {
        @Override
        public long stepsBetween(Long start, Long end) {
            if (start > end) {
                return -1;
            }
            final long diff = end - start;
            return diff < 0 ? -1 : diff; // wrapped: more than Long.MAX_VALUE steps
        }

        @Override
        public Long forward(Long value, long count) {
            checkCount(count);
            return value <= Long.MAX_VALUE - count ? value + count : null;
        }

        @Override
        public Long backward(Long value, long count) {
            checkCount(count);
            return value >= Long.MIN_VALUE + count ? value - count : null;
        }

        @Override
        public Long min() {
            return Long.MIN_VALUE;
        }

        @Override
        public Long max() {
            return Long.MAX_VALUE;
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }

        @Override
        public String toString() {
            return "longs";
        }
    };

    public static final Step<Boolean> BOOLEANS = new Step<>() {
        @Override
        public long stepsBetween(Boolean start, Boolean end) {
            final int s = start ? 1 : 0;
            final int e = end ? 1 : 0;
            return s <= e ? e - s : -1;
        }

        @Override
        public Boolean forward(Boolean value, long count) {
            checkCount(count);
            final long result = (value ? 1 : 0) + count;
            return result <= 1 ? result == 1 : null;
        }

        @Override
        public Boolean backward(Boolean value, long count) {
            checkCount(count);
            final long result = (value ? 1 : 0) - count;
            return result >= 0 ? result == 1 : null;
        }

        @Override
        public Boolean min() {
            return false;
        }

        @Override
        public Boolean max() {
            return true;
        }

        @Override
        public int compare(Boolean a, Boolean b) {
            return Boolean.compare(a, b);
        }

        @Override
        public String toString() {
            return "booleans";
        }
    };

    /**
     * UTF-16 code units {@code 0x0000..0xFFFF} minus the surrogates.
     */
    public static final Step<Character> CHARACTERS = new UnicodeStep<>("characters", Character.MAX_VALUE) {
        @Override
        int toInt(Character value) {
            return value;
        }

        @Override
        Character box(int value) {
            return (char) value;
        }
    };

    /**
     * Unicode scalar values: code points {@code 0..0x10FFFF} minus the surrogates.
     */
    public static final Step<Integer> CODE_POINTS = new UnicodeStep<>("code points", Character.MAX_CODE_POINT) {
        @Override
        int toInt(Integer value) {
            return value;
        }

        @Override
        Integer box(int value) {
            return value;
        }
    };

    static void checkCount(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("negative step count: " + count);
        }
    }

    /**
     * Integral types of at most 32 bits; every distance fits in a {@code long}.
     */
    private abstract static class NarrowIntegral<T extends Number> implements Step<T> {
        private final String name;
        private final long min;
        private final long max;

        NarrowIntegral(String name, long min, long max) {
            this.name = name;
            this.min = min;
            this.max = max;
        }

        abstract T box(long value);

        @Override
        public long stepsBetween(T start, T end) {
            final long s = start.longValue();
            final long e = end.longValue();
            return s <= e ? e - s : -1;
        }

        @Override
        public T forward(T value, long count) {
            checkCount(count);
            final long v = value.longValue();
            return count <= max - v ? box(v + count) : null;
        }

        @Override
        public T backward(T value, long count) {
            checkCount(count);
            final long v = value.longValue();
            return count <= v - min ? box(v - count) : null;
        }

        @Override
        public T min() {
            return box(min);
        }

        @Override
        public T max() {
            return box(max);
        }

        @Override
        public int compare(T a, T b) {
            return Long.compare(a.longValue(), b.longValue());
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Character-like values from 0 to {@code max}, skipping the surrogate gap.
     * Values inside the gap are not valid inputs.
     */
    private abstract static class UnicodeStep<T> implements Step<T> {
        private final String name;
        private final int max;

        UnicodeStep(String name, int max) {
            this.name = name;
            this.max = max;
        }

        abstract int toInt(T value);

        abstract T box(int value);

        @Override
        public boolean isValid(T value) {
            final int v = toInt(value);
            return v >= 0 && v <= max && (v < SURROGATE_LOW || v > SURROGATE_HIGH);
        }

        @Override
        public long stepsBetween(T start, T end) {
            final long s = toInt(start);
            final long e = toInt(end);
            if (s > e) {
                return -1;
            } else if (s < SURROGATE_LOW && e > SURROGATE_HIGH) {
                return (e - s) - SURROGATE_GAP;
            }
            return e - s;
        }

        @Override
        public T forward(T value, long count) {
            checkCount(count);
            if (count > max) {
                return null;
            }
            final long v = toInt(value);
            long out = v + count;
            if (v < SURROGATE_LOW && out >= SURROGATE_LOW) {
                out += SURROGATE_GAP; // jumped over the gap
            }
            return out <= max ? box((int) out) : null;
        }

        @Override
        public T backward(T value, long count) {
            checkCount(count);
            if (count > max) {
                return null;
            }
            final long v = toInt(value);
            long out = v - count;
            if (v > SURROGATE_HIGH && out <= SURROGATE_HIGH) {
                out -= SURROGATE_GAP;
            }
            return out >= 0 ? box((int) out) : null;
        }

        @Override
        public T min() {
            return box(0);
        }

        @Override
        public T max() {
            return box(max);
        }

        @Override
        public int compare(T a, T b) {
            return Integer.compare(toInt(a), toInt(b));
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
