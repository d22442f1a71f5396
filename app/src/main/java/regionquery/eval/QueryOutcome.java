package regionquery.eval;

import java.util.List;
import regionquery.model.Point;

/** Ordered result of one query. */
public record QueryOutcome(List<Point> points, int nodeCount, long evaluateMs) {

  public QueryOutcome {
    points = List.copyOf(points);
  }

  public int size() {
    return points.size();
  }
}
