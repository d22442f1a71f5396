package regionquery.model;

/**
 * Immutable inspection point. Identity is {@link #id()}; the remaining fields are attributes that
 * the store reports for that id.
 */
public record Point(long id, long groupId, double x, double y, int category) {

  public Point {
    // -0.0 and 0.0 are the same coordinate
    x = x == 0.0 ? 0.0 : x;
    y = y == 0.0 ? 0.0 : y;
  }

  public boolean within(Box box) {
    return box.contains(x, y);
  }

  @Override
  public String toString() {
    return "#" + id + " (" + x + ", " + y + ") group=" + groupId + " category=" + category;
  }
}
