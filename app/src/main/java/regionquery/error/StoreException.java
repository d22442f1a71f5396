package regionquery.error;

/** The point store was reachable but failed to execute a request. */
public final class StoreException extends RegionQueryException {
  private static final long serialVersionUID = 1L;

  public StoreException(Stage stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
