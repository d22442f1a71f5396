package regionquery.error;

/** The point store could not be reached or its connection broke. */
public final class StoreUnavailableException extends RegionQueryException {
  private static final long serialVersionUID = 1L;

  public StoreUnavailableException(Stage stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
