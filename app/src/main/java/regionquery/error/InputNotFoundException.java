package regionquery.error;

import java.nio.file.Path;

/** A query description or data file does not exist. */
public final class InputNotFoundException extends RegionQueryException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  public InputNotFoundException(Stage stage, Path path) {
    super(stage, "Input not found: " + path);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
