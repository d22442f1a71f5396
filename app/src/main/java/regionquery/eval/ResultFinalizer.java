package regionquery.eval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import regionquery.model.Point;

/** Orders a result for output: ascending y, then x, then id for points on the same spot. */
public final class ResultFinalizer {
  public static final Comparator<Point> OUTPUT_ORDER =
      Comparator.comparingDouble(Point::y)
          .thenComparingDouble(Point::x)
          .thenComparingLong(Point::id);

  private ResultFinalizer() {}

  public static List<Point> order(ResultSet result) {
    List<Point> ordered = new ArrayList<>(result.points());
    ordered.sort(OUTPUT_ORDER);
    return List.copyOf(ordered);
  }
}
