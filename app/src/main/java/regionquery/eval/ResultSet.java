package regionquery.eval;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import regionquery.model.Point;

/**
 * Immutable set of points keyed by id. Iteration follows ascending id, so two sets holding the same
 * points always iterate identically.
 */
public final class ResultSet {
  private static final ResultSet EMPTY = new ResultSet(new TreeMap<>());

  private final NavigableMap<Long, Point> byId;

  private ResultSet(NavigableMap<Long, Point> byId) {
    this.byId = Collections.unmodifiableNavigableMap(byId);
  }

  public static ResultSet empty() {
    return EMPTY;
  }

  /** Collects {@code points}; a repeated id keeps its first occurrence. */
  public static ResultSet of(Collection<Point> points) {
    Objects.requireNonNull(points, "points");
    if (points.isEmpty()) {
      return EMPTY;
    }
    NavigableMap<Long, Point> map = new TreeMap<>();
    for (Point point : points) {
      map.putIfAbsent(point.id(), point);
    }
    return new ResultSet(map);
  }

  public static ResultSet of(Point... points) {
    return of(List.of(points));
  }

  /** Points whose id is in both sets. */
  public ResultSet intersect(ResultSet other) {
    Objects.requireNonNull(other, "other");
    if (isEmpty() || other.isEmpty()) {
      return EMPTY;
    }
    ResultSet smaller = size() <= other.size() ? this : other;
    ResultSet larger = smaller == this ? other : this;
    NavigableMap<Long, Point> map = new TreeMap<>();
    for (Map.Entry<Long, Point> entry : smaller.byId.entrySet()) {
      if (larger.byId.containsKey(entry.getKey())) {
        map.put(entry.getKey(), entry.getValue());
      }
    }
    return map.isEmpty() ? EMPTY : new ResultSet(map);
  }

  /** Points whose id is in either set, one entry per id. */
  public ResultSet union(ResultSet other) {
    Objects.requireNonNull(other, "other");
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    NavigableMap<Long, Point> map = new TreeMap<>(byId);
    for (Map.Entry<Long, Point> entry : other.byId.entrySet()) {
      map.putIfAbsent(entry.getKey(), entry.getValue());
    }
    return new ResultSet(map);
  }

  public static ResultSet intersectAll(List<ResultSet> sets) {
    if (sets.isEmpty()) {
      throw new IllegalArgumentException("intersection of zero sets is undefined");
    }
    ResultSet result = sets.get(0);
    for (int i = 1; i < sets.size() && !result.isEmpty(); i++) {
      result = result.intersect(sets.get(i));
    }
    return result;
  }

  public static ResultSet unionAll(List<ResultSet> sets) {
    ResultSet result = EMPTY;
    for (ResultSet set : sets) {
      result = result.union(set);
    }
    return result;
  }

  public int size() {
    return byId.size();
  }

  public boolean isEmpty() {
    return byId.isEmpty();
  }

  public boolean contains(long id) {
    return byId.containsKey(id);
  }

  public Point get(long id) {
    return byId.get(id);
  }

  public Set<Long> ids() {
    return byId.keySet();
  }

  public Collection<Point> points() {
    return byId.values();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ResultSet other)) {
      return false;
    }
    return byId.equals(other.byId);
  }

  @Override
  public int hashCode() {
    return byId.hashCode();
  }

  @Override
  public String toString() {
    return "ResultSet" + byId.keySet();
  }
}
