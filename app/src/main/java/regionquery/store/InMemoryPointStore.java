package regionquery.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.model.Box;
import regionquery.model.CropFilter;
import regionquery.model.Point;

/**
 * Immutable store held entirely in memory. Points are kept sorted by {@code x} so a range scan only
 * visits the x-slab of the box; group bounds are precomputed so containment is a per-group
 * rectangle test. Safe for concurrent readers.
 */
public final class InMemoryPointStore implements PointStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryPointStore.class);

  private final Point[] byX;
  private final double[] xs;
  private final Map<Long, List<Point>> groups;
  private final Map<Long, GroupBounds> bounds;

  private InMemoryPointStore(List<Point> points) {
    List<Point> sorted = new ArrayList<>(points);
    sorted.sort(Comparator.comparingDouble(Point::x).thenComparingLong(Point::id));
    this.byX = sorted.toArray(new Point[0]);
    this.xs = new double[byX.length];
    for (int i = 0; i < byX.length; i++) {
      xs[i] = byX[i].x();
    }
    Map<Long, List<Point>> members = new TreeMap<>();
    Map<Long, GroupBounds> extents = new HashMap<>();
    for (Point point : points) {
      members.computeIfAbsent(point.groupId(), ignored -> new ArrayList<>()).add(point);
      extents.merge(point.groupId(), GroupBounds.of(point), GroupBounds::union);
    }
    members.replaceAll((id, list) -> Collections.unmodifiableList(list));
    this.groups = Collections.unmodifiableMap(members);
    this.bounds = Map.copyOf(extents);
  }

  public static InMemoryPointStore of(Dataset dataset) {
    Objects.requireNonNull(dataset, "dataset");
    InMemoryPointStore store = new InMemoryPointStore(dataset.points());
    LOG.info("In-memory store holds {} points in {} groups", store.size(), store.groups.size());
    return store;
  }

  public static InMemoryPointStore of(Point... points) {
    return of(Dataset.of(points));
  }

  @Override
  public Set<Point> rangeScan(Box box, OptionalInt category, Set<Long> groupIds) {
    Objects.requireNonNull(box, "box");
    CropFilter filter = new CropFilter(box, category, groupIds, false);
    Set<Point> matches = new LinkedHashSet<>();
    for (int i = lowerBound(box.minX()); i < byX.length && xs[i] <= box.maxX(); i++) {
      if (filter.matches(byX[i])) {
        matches.add(byX[i]);
      }
    }
    LOG.debug("rangeScan {} -> {} points", filter, matches.size());
    return matches;
  }

  @Override
  public Set<Point> pointsByGroup(long groupId) {
    return new LinkedHashSet<>(groups.getOrDefault(groupId, List.of()));
  }

  @Override
  public Set<Long> groupIds() {
    return groups.keySet();
  }

  @Override
  public Set<Long> fullyContainedGroups(Box box) {
    Objects.requireNonNull(box, "box");
    Set<Long> contained = new LinkedHashSet<>();
    for (Long groupId : groups.keySet()) {
      if (bounds.get(groupId).within(box)) {
        contained.add(groupId);
      }
    }
    LOG.debug("fullyContainedGroups {} -> {} groups", box, contained.size());
    return contained;
  }

  @Override
  public long size() {
    return byX.length;
  }

  @Override
  public void close() {
    // nothing held outside the heap
  }

  /** First index whose x is not below {@code minX}. */
  private int lowerBound(double minX) {
    int lo = 0;
    int hi = xs.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (xs[mid] < minX) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private record GroupBounds(double minX, double minY, double maxX, double maxY) {
    static GroupBounds of(Point point) {
      return new GroupBounds(point.x(), point.y(), point.x(), point.y());
    }

    GroupBounds union(GroupBounds other) {
      return new GroupBounds(
          Math.min(minX, other.minX),
          Math.min(minY, other.minY),
          Math.max(maxX, other.maxX),
          Math.max(maxY, other.maxY));
    }

    boolean within(Box box) {
      return box.encloses(minX, minY, maxX, maxY);
    }
  }
}
