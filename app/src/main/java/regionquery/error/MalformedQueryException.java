package regionquery.error;

/**
 * A query description could not be parsed or does not describe a valid predicate tree. The message
 * starts with the JSON path of the offending node when one is known.
 */
public final class MalformedQueryException extends RegionQueryException {
  private static final long serialVersionUID = 1L;

  private final String jsonPath;

  public MalformedQueryException(String jsonPath, String message) {
    super(Stage.BUILD, jsonPath + ": " + message);
    this.jsonPath = jsonPath;
  }

  public MalformedQueryException(String message, Throwable cause) {
    super(Stage.PARSE, message, cause);
    this.jsonPath = "$";
  }

  public String jsonPath() {
    return jsonPath;
  }
}
