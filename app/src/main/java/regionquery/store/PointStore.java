package regionquery.store;

import java.util.LinkedHashSet;
import java.util.OptionalInt;
import java.util.Set;
import regionquery.model.Box;
import regionquery.model.Point;

/**
 * System of record for inspection points. The evaluator only talks to the store through these
 * primitives and treats everything they return as a read-only snapshot.
 *
 * <p>A store is a handle with an explicit lifetime: open it once per command and close it on every
 * exit path.
 */
public interface PointStore extends AutoCloseable {

  /**
   * Points inside {@code box} (inclusive bounds) whose category equals {@code category} when one is
   * given and whose group is in {@code groupIds} when that set is non-empty.
   */
  Set<Point> rangeScan(Box box, OptionalInt category, Set<Long> groupIds);

  /** Every member of the group; empty for an unknown group. */
  Set<Point> pointsByGroup(long groupId);

  /** Ids of all groups that have at least one point. */
  Set<Long> groupIds();

  /** Number of points held. */
  long size();

  /**
   * Ids of the groups whose every member lies inside {@code box}. The default walks each group
   * through {@link #pointsByGroup(long)}; implementations that can answer directly should.
   */
  default Set<Long> fullyContainedGroups(Box box) {
    Set<Long> contained = new LinkedHashSet<>();
    for (long groupId : groupIds()) {
      Set<Point> members = pointsByGroup(groupId);
      if (!members.isEmpty() && members.stream().allMatch(p -> p.within(box))) {
        contained.add(groupId);
      }
    }
    return contained;
  }

  @Override
  void close();
}
