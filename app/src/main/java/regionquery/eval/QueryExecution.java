package regionquery.eval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.model.Point;
import regionquery.query.PredicateNode;
import regionquery.query.QueryTreeBuilder;
import regionquery.store.PointStore;

/**
 * Runs one query: build the tree from its description, evaluate it against a store, order the
 * result. Building needs no store, so a malformed query fails before any connection is opened.
 */
public final class QueryExecution {
  private static final Logger LOG = LoggerFactory.getLogger(QueryExecution.class);

  private final QueryTreeBuilder builder = new QueryTreeBuilder();
  private final EvaluationOptions options;

  public QueryExecution(EvaluationOptions options) {
    this.options = EvaluationOptions.normalize(options);
  }

  public PredicateNode build(Path queryFile) throws IOException {
    Objects.requireNonNull(queryFile, "queryFile");
    long start = System.nanoTime();
    PredicateNode tree = builder.read(queryFile);
    LOG.info(
        "Built query tree with {} nodes from {} in {} ms",
        tree.nodeCount(),
        queryFile,
        (System.nanoTime() - start) / 1_000_000L);
    return tree;
  }

  public QueryOutcome evaluate(PredicateNode tree, PointStore store) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(store, "store");
    long start = System.nanoTime();
    ResultSet result = new QueryEvaluator(store, options).evaluate(tree);
    List<Point> ordered = ResultFinalizer.order(result);
    long evaluateMs = (System.nanoTime() - start) / 1_000_000L;
    LOG.info(
        "Query matched {} points in {} ms ({})",
        ordered.size(),
        evaluateMs,
        options.parallel() ? "parallel x" + options.parallelism() : "sequential");
    return new QueryOutcome(ordered, tree.nodeCount(), evaluateMs);
  }
}
