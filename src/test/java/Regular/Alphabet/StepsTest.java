package Regular.Alphabet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

class StepsTest {

    @Test
    @DisplayName("code points skip the surrogate gap")
    public void testCodePointCount() {
        Assertions.assertEquals(1112063L, Steps.CODE_POINTS.stepsBetween(0, Character.MAX_CODE_POINT));
        Assertions.assertEquals(0xFFFFL - 2048, Steps.CHARACTERS.stepsBetween('\0', Character.MAX_VALUE));
    }

    @Test
    @DisplayName("successor and predecessor jump over the surrogates")
    public void testSurrogateGap() {
        Assertions.assertEquals((Character) (char) 0xE000, Steps.CHARACTERS.successor((char) 0xD7FF));
        Assertions.assertEquals((Character) (char) 0xD7FF, Steps.CHARACTERS.predecessor((char) 0xE000));
        Assertions.assertEquals(0xE000, (int) Steps.CODE_POINTS.successor(0xD7FF));
        Assertions.assertEquals(0xD7FF, (int) Steps.CODE_POINTS.predecessor(0xE000));

        Assertions.assertEquals(0xE000 + 9, (int) Steps.CODE_POINTS.forward(0xD7FF - 10, 20));
        Assertions.assertEquals(0xD7FF - 9, (int) Steps.CODE_POINTS.backward(0xE000 + 10, 20));
        Assertions.assertEquals(20L, Steps.CODE_POINTS.stepsBetween(0xD7FF - 10, 0xE000 + 9));

        Assertions.assertFalse(Steps.CODE_POINTS.isValid(0xD800));
        Assertions.assertFalse(Steps.CHARACTERS.isValid((char) 0xDFFF));
        Assertions.assertTrue(Steps.CHARACTERS.isValid('a'));
    }

    @Test
    @DisplayName("forward/backward agree with stepsBetween across the gap")
    public void testRandomCharacterArithmetic() {
        final Random rnd = new Random(7);
        for (int i = 0; i < 1000; i++) {
            int a = rnd.nextInt(Character.MAX_CODE_POINT + 1);
            int b = rnd.nextInt(Character.MAX_CODE_POINT + 1);
            if (!Steps.CODE_POINTS.isValid(a) || !Steps.CODE_POINTS.isValid(b)) {
                continue;
            }
            if (a > b) {
                final int t = a;
                a = b;
                b = t;
            }
            final long n = Steps.CODE_POINTS.stepsBetween(a, b);
            Assertions.assertEquals(Integer.valueOf(b), Steps.CODE_POINTS.forward(a, n), a + " + " + n);
            Assertions.assertEquals(Integer.valueOf(a), Steps.CODE_POINTS.backward(b, n), b + " - " + n);
            if (a != b) {
                Assertions.assertEquals(-1L, Steps.CODE_POINTS.stepsBetween(b, a));
            }
        }
    }

    @Test
    @DisplayName("overflow: null from forward/backward, exceptions from successor/predecessor")
    public void testOverflow() {
        Assertions.assertNull(Steps.BYTES.forward(Byte.MAX_VALUE, 1));
        Assertions.assertNull(Steps.SHORTS.backward(Short.MIN_VALUE, 1));
        Assertions.assertNull(Steps.INTEGERS.forward(0, (long) Integer.MAX_VALUE + 1));
        Assertions.assertNull(Steps.LONGS.forward(Long.MAX_VALUE - 1, 2));
        Assertions.assertNull(Steps.BOOLEANS.forward(true, 1));
        Assertions.assertNull(Steps.CHARACTERS.forward(Character.MAX_VALUE, 1));
        Assertions.assertNull(Steps.CODE_POINTS.backward(0, 1));

        Assertions.assertThrows(ArithmeticException.class, () -> Steps.INTEGERS.successor(Integer.MAX_VALUE));
        Assertions.assertThrows(ArithmeticException.class, () -> Steps.LONGS.predecessor(Long.MIN_VALUE));
        Assertions.assertThrows(ArithmeticException.class, () -> Steps.CODE_POINTS.successor(Character.MAX_CODE_POINT));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Steps.INTEGERS.forward(0, -1));
    }

    @Test
    @DisplayName("saturating variants stay put at the bounds")
    public void testSaturating() {
        Assertions.assertEquals(Byte.MAX_VALUE, (byte) Steps.BYTES.successorSaturating(Byte.MAX_VALUE));
        Assertions.assertEquals((byte) 6, (byte) Steps.BYTES.successorSaturating((byte) 5));
        Assertions.assertEquals(Long.MIN_VALUE, (long) Steps.LONGS.predecessorSaturating(Long.MIN_VALUE));
        Assertions.assertEquals(Boolean.FALSE, Steps.BOOLEANS.predecessorSaturating(false));
        Assertions.assertEquals(Boolean.TRUE, Steps.BOOLEANS.successorSaturating(false));
        Assertions.assertEquals((Character) Character.MAX_VALUE, Steps.CHARACTERS.successorSaturating(Character.MAX_VALUE));
    }

    @Test
    @DisplayName("distances that do not fit in a long are -1")
    public void testLongDistance() {
        Assertions.assertEquals(-1L, Steps.LONGS.stepsBetween(Long.MIN_VALUE, Long.MAX_VALUE));
        Assertions.assertEquals(Long.MAX_VALUE, Steps.LONGS.stepsBetween(-1L, Long.MAX_VALUE - 1));
        Assertions.assertEquals(-1L, Steps.LONGS.stepsBetween(5L, 4L));
        Assertions.assertEquals((1L << 32) - 1, Steps.INTEGERS.stepsBetween(Integer.MIN_VALUE, Integer.MAX_VALUE));
        Assertions.assertEquals(255L, Steps.BYTES.stepsBetween(Byte.MIN_VALUE, Byte.MAX_VALUE));
        Assertions.assertEquals(1L, Steps.BOOLEANS.stepsBetween(false, true));
    }

    @Test
    @DisplayName("min/max bounds")
    public void testBounds() {
        for (Step<?> step : List.of(Steps.BYTES, Steps.SHORTS, Steps.INTEGERS, Steps.LONGS, Steps.BOOLEANS,
                Steps.CHARACTERS, Steps.CODE_POINTS)) {
            Assertions.assertTrue(checkBounds(step), step.toString());
        }
    }

    private static <T> boolean checkBounds(Step<T> step) {
        return step.compare(step.min(), step.max()) < 0
                && step.forward(step.max(), 1) == null
                && step.backward(step.min(), 1) == null;
    }
}
