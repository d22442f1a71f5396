package regionquery.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;
import regionquery.model.CropFilter;
import regionquery.query.PredicateNode;
import regionquery.testing.TestStores;

final class EvaluationOptionsTest {

  @Test
  void missingOrNonPositiveParallelismFallsBackToProcessors() {
    int processors = Runtime.getRuntime().availableProcessors();

    assertFalse(EvaluationOptions.normalize(null).parallel());
    assertEquals(processors, EvaluationOptions.normalize(null).parallelism());
    assertEquals(processors, EvaluationOptions.parallel(0).parallelism());
    assertEquals(processors, EvaluationOptions.parallel(-4).parallelism());
  }

  @Test
  void oversizedParallelismIsCapped() {
    EvaluationOptions options = EvaluationOptions.parallel(1_000_000);

    assertTrue(options.parallel());
    assertEquals(EvaluationOptions.MAX_PARALLELISM, options.parallelism());
    assertEquals(
        EvaluationOptions.MAX_PARALLELISM,
        EvaluationOptions.normalize(new EvaluationOptions(true, Integer.MAX_VALUE)).parallelism());
  }

  @Test
  void evaluatorRunsWithCappedParallelism() {
    PredicateNode query =
        PredicateNode.or(
            PredicateNode.crop(CropFilter.box(TestStores.UNIT_BOX)),
            PredicateNode.crop(CropFilter.box(TestStores.UNIT_BOX).withCategory(3)));
    QueryEvaluator evaluator =
        new QueryEvaluator(
            TestStores.inMemory(),
            new EvaluationOptions(true, EvaluationOptions.MAX_PARALLELISM + 1));

    assertEquals(Set.of(1L, 2L, 3L, 4L, 8L), evaluator.evaluate(query).ids());
  }
}
