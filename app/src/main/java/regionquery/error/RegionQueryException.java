package regionquery.error;

import java.util.Objects;

/**
 * Base type for every failure a region query can surface. Failures are never recovered inside the
 * evaluator; they travel to the command that started the work, which reports {@link #stage()} and
 * exits non-zero.
 */
public abstract class RegionQueryException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Stage stage;

  protected RegionQueryException(Stage stage, String message) {
    super(message);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  protected RegionQueryException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public Stage stage() {
    return stage;
  }
}
