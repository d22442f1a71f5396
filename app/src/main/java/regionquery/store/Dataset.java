package regionquery.store;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import regionquery.model.Point;

/** Points read from a bulk data directory, in file order. */
public record Dataset(List<Point> points) {

  public Dataset {
    points = List.copyOf(Objects.requireNonNull(points, "points"));
    Set<Long> seen = new HashSet<>();
    for (Point point : points) {
      if (!seen.add(point.id())) {
        throw new IllegalArgumentException("Duplicate point id " + point.id());
      }
    }
  }

  public static Dataset of(Point... points) {
    return new Dataset(List.of(points));
  }

  public int size() {
    return points.size();
  }

  public Set<Long> groupIds() {
    Set<Long> groups = new TreeSet<>();
    for (Point point : points) {
      groups.add(point.groupId());
    }
    return groups;
  }
}
