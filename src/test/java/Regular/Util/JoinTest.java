package Regular.Util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

class JoinTest {

  @Test
  @DisplayName("a custom logic alternating between the two sides")
  public void testFlipFlop() {
    final boolean[] takeLeft = {true};
    final Join<Integer> join = new Join<>(List.of(1, 3, 5, 7), List.of(2, 4), (left, right) -> {
      final Join.Cursor<Integer> preferred = takeLeft[0] ? left : right;
      final Join.Cursor<Integer> other = takeLeft[0] ? right : left;
      takeLeft[0] = !takeLeft[0];
      final Integer next = preferred.next();
      return next != null ? next : other.next();
    });

    final List<Integer> out = new ArrayList<>();
    join.forEachRemaining(out::add);
    Assertions.assertEquals(List.of(1, 2, 3, 4, 5, 7), out);
    Assertions.assertFalse(join.hasNext());
    Assertions.assertThrows(NoSuchElementException.class, join::next);
  }

  @Test
  @DisplayName("peek does not consume")
  public void testPeek() {
    final Join<String> join = new Join<>(List.of("a", "b"), Collections.<String>emptyList(), (left, right) -> {
      Assertions.assertNull(right.peek());
      final String head = left.peek();
      Assertions.assertEquals(head, left.peek());
      return left.next();
    });
    Assertions.assertEquals("a", join.next());
    Assertions.assertEquals("b", join.next());
    Assertions.assertFalse(join.hasNext());
  }

  @Test
  @DisplayName("hasNext is idempotent")
  public void testHasNextIdempotent() {
    final int[] calls = {0};
    final Join<Integer> join = new Join<>(List.of(1), List.of(2), (left, right) -> {
      calls[0]++;
      return left.next();
    });
    Assertions.assertTrue(join.hasNext());
    Assertions.assertTrue(join.hasNext());
    Assertions.assertEquals(1, calls[0]);
    Assertions.assertEquals(1, join.next());
    Assertions.assertFalse(join.hasNext());
    Assertions.assertFalse(join.hasNext());
    Assertions.assertEquals(2, calls[0]);
  }
}
