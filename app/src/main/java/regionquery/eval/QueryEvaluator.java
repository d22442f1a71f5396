package regionquery.eval;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.model.CropFilter;
import regionquery.model.Point;
import regionquery.query.PredicateNode;
import regionquery.store.PointStore;

/**
 * Evaluates a {@link PredicateNode} against a {@link PointStore}.
 *
 * <ul>
 *   <li>{@code crop}: the store's range scan. With {@code proper}, points are kept only when their
 *       whole group, unfiltered, lies inside the box.
 *   <li>{@code and}: intersection by point id.
 *   <li>{@code or}: union by point id.
 * </ul>
 *
 * <p>Store failures propagate unchanged; nothing partial is returned.
 */
public final class QueryEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEvaluator.class);

  private final PointStore store;
  private final EvaluationOptions options;

  public QueryEvaluator(PointStore store) {
    this(store, EvaluationOptions.defaults());
  }

  public QueryEvaluator(PointStore store, EvaluationOptions options) {
    this.store = Objects.requireNonNull(store, "store");
    this.options = EvaluationOptions.normalize(options);
  }

  public ResultSet evaluate(PredicateNode node) {
    Objects.requireNonNull(node, "node");
    if (!options.parallel()) {
      return evaluateNode(node, false);
    }
    ForkJoinPool pool = new ForkJoinPool(options.parallelism());
    try {
      return pool.submit(() -> evaluateNode(node, true)).join();
    } finally {
      pool.shutdown();
    }
  }

  private ResultSet evaluateNode(PredicateNode node, boolean parallel) {
    if (node instanceof PredicateNode.Crop crop) {
      return crop(crop.filter());
    }
    if (node instanceof PredicateNode.And and) {
      return parallel ? intersectParallel(and.children()) : intersect(and.children());
    }
    if (node instanceof PredicateNode.Or or) {
      return ResultSet.unionAll(evaluateChildren(or.children(), parallel));
    }
    throw new IllegalStateException("Unsupported predicate node: " + node.getClass().getName());
  }

  private ResultSet crop(CropFilter filter) {
    Set<Point> raw = store.rangeScan(filter.box(), filter.category(), filter.oneOfGroups());
    if (!filter.proper() || raw.isEmpty()) {
      LOG.debug("{} matched {} points", filter, raw.size());
      return ResultSet.of(raw);
    }
    Set<Long> contained = store.fullyContainedGroups(filter.box());
    List<Point> kept = raw.stream().filter(p -> contained.contains(p.groupId())).toList();
    LOG.debug(
        "{} matched {} points, {} kept after group containment", filter, raw.size(), kept.size());
    return ResultSet.of(kept);
  }

  private ResultSet intersect(List<PredicateNode> children) {
    ResultSet result = null;
    for (int i = 0; i < children.size(); i++) {
      ResultSet next = evaluateNode(children.get(i), false);
      result = result == null ? next : result.intersect(next);
      if (result.isEmpty()) {
        if (i + 1 < children.size()) {
          LOG.debug(
              "Intersection empty after operand {}; skipping {} more",
              i,
              children.size() - i - 1);
        }
        return ResultSet.empty();
      }
    }
    return result;
  }

  private ResultSet intersectParallel(List<PredicateNode> children) {
    return ResultSet.intersectAll(evaluateChildren(children, true));
  }

  private List<ResultSet> evaluateChildren(List<PredicateNode> children, boolean parallel) {
    if (parallel && children.size() > 1) {
      // runs inside the pool that evaluate() submitted to
      return children.parallelStream().map(child -> evaluateNode(child, true)).toList();
    }
    return children.stream().map(child -> evaluateNode(child, parallel)).toList();
  }
}
