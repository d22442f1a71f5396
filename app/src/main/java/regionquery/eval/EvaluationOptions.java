package regionquery.eval;

/**
 * Evaluation knobs. Parallel mode evaluates the children of each {@code and} / {@code or} node
 * concurrently; results are identical either way.
 */
public record EvaluationOptions(boolean parallel, int parallelism) {
  /** Largest parallelism a {@link java.util.concurrent.ForkJoinPool} accepts. */
  static final int MAX_PARALLELISM = 0x7fff;

  public static EvaluationOptions defaults() {
    return new EvaluationOptions(false, Runtime.getRuntime().availableProcessors());
  }

  public static EvaluationOptions parallel(int parallelism) {
    return normalize(new EvaluationOptions(true, parallelism));
  }

  public static EvaluationOptions normalize(EvaluationOptions options) {
    if (options == null) {
      return defaults();
    }
    int parallelism =
        options.parallelism() > 0 ? options.parallelism() : defaults().parallelism();
    parallelism = Math.min(parallelism, MAX_PARALLELISM);
    return new EvaluationOptions(options.parallel(), parallelism);
  }
}
