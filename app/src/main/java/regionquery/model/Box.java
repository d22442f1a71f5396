package regionquery.model;

/** Axis-aligned rectangle with inclusive bounds on every side. */
public record Box(double minX, double minY, double maxX, double maxY) {

  public Box {
    requireFinite(minX, "minX");
    requireFinite(minY, "minY");
    requireFinite(maxX, "maxX");
    requireFinite(maxY, "maxY");
    if (minX > maxX) {
      throw new IllegalArgumentException("minX " + minX + " exceeds maxX " + maxX);
    }
    if (minY > maxY) {
      throw new IllegalArgumentException("minY " + minY + " exceeds maxY " + maxY);
    }
  }

  public static Box of(double minX, double minY, double maxX, double maxY) {
    return new Box(minX, minY, maxX, maxY);
  }

  public boolean contains(double x, double y) {
    return x >= minX && x <= maxX && y >= minY && y <= maxY;
  }

  /** True when the whole of {@code [loX, hiX] x [loY, hiY]} lies inside this box. */
  public boolean encloses(double loX, double loY, double hiX, double hiY) {
    return loX >= minX && hiX <= maxX && loY >= minY && hiY <= maxY;
  }

  private static void requireFinite(double value, String name) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(name + " must be finite: " + value);
    }
  }

  @Override
  public String toString() {
    return "[(" + minX + ", " + minY + ") .. (" + maxX + ", " + maxY + ")]";
  }
}
