package regionquery.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import regionquery.error.MalformedQueryException;
import regionquery.model.Point;
import regionquery.query.PredicateNode;
import regionquery.testing.TestStores;

final class QueryExecutionTest {
  @TempDir Path dir;

  @Test
  void buildsEvaluatesAndOrders() throws IOException {
    Path queryFile = dir.resolve("q.json");
    Files.writeString(
        queryFile,
        "{\"query\": {\"operator_and\": ["
            + "{\"operator_crop\": {\"region\": {\"p_min\": {\"x\": 0, \"y\": 0},"
            + " \"p_max\": {\"x\": 5, \"y\": 5}}, \"proper\": true}},"
            + "{\"operator_crop\": {\"region\": {\"p_min\": {\"x\": 0, \"y\": 0},"
            + " \"p_max\": {\"x\": 9, \"y\": 9}}, \"category\": 1}}]}}",
        StandardCharsets.UTF_8);
    QueryExecution execution = new QueryExecution(EvaluationOptions.defaults());

    PredicateNode tree = execution.build(queryFile);
    QueryOutcome outcome = execution.evaluate(tree, TestStores.inMemory());

    assertEquals(3, outcome.nodeCount());
    assertEquals(List.of(1L, 3L, 8L), outcome.points().stream().map(Point::id).toList());
    assertEquals(3, outcome.size());
  }

  @Test
  void malformedDescriptionFailsBeforeEvaluation() throws IOException {
    Path queryFile = dir.resolve("q.json");
    Files.writeString(queryFile, "{\"query\": {\"operator_nand\": []}}", StandardCharsets.UTF_8);

    assertThrows(
        MalformedQueryException.class,
        () -> new QueryExecution(EvaluationOptions.parallel(2)).build(queryFile));
  }
}
