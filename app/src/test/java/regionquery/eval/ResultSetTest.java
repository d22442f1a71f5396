package regionquery.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import regionquery.model.Point;

final class ResultSetTest {
  private static final Point A = new Point(1, 1, 0, 0, 1);
  private static final Point B = new Point(2, 1, 1, 1, 1);
  private static final Point C = new Point(3, 2, 2, 2, 2);

  @Test
  void repeatedIdsCollapseToOneEntry() {
    Point shadow = new Point(1, 9, 7, 7, 9);
    ResultSet set = ResultSet.of(List.of(A, B, shadow));

    assertEquals(2, set.size());
    assertSame(A, set.get(1));
    assertEquals(List.of(1L, 2L), List.copyOf(set.ids()));
  }

  @Test
  void intersectKeepsSharedIds() {
    ResultSet left = ResultSet.of(A, B);
    ResultSet right = ResultSet.of(B, C);

    assertEquals(ResultSet.of(B), left.intersect(right));
    assertEquals(left.intersect(right), right.intersect(left));
    assertTrue(left.intersect(ResultSet.empty()).isEmpty());
  }

  @Test
  void unionKeepsEveryIdOnce() {
    ResultSet union = ResultSet.of(A, B).union(ResultSet.of(B, C));

    assertEquals(Set.of(1L, 2L, 3L), union.ids());
    assertEquals(union, ResultSet.of(C).union(ResultSet.of(A, B)));
  }

  @Test
  void foldsOverLists() {
    assertEquals(
        ResultSet.of(B),
        ResultSet.intersectAll(
            List.of(ResultSet.of(A, B, C), ResultSet.of(B, C), ResultSet.of(A, B))));
    assertEquals(ResultSet.of(A, C), ResultSet.unionAll(List.of(ResultSet.of(A), ResultSet.of(C))));
    assertSame(ResultSet.empty(), ResultSet.unionAll(List.of()));
    assertThrows(IllegalArgumentException.class, () -> ResultSet.intersectAll(List.of()));
  }

  @Test
  void viewsAreReadOnly() {
    ResultSet set = ResultSet.of(A, B);
    assertThrows(UnsupportedOperationException.class, () -> set.ids().remove(1L));
    assertThrows(UnsupportedOperationException.class, () -> set.points().clear());
  }
}
