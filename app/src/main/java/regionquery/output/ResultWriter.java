package regionquery.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.model.Point;

/**
 * Writes a query result as text, one {@code "<x> <y>"} line per point.
 *
 * <p>Lines go to a temporary sibling file that replaces the target only once everything was
 * written, so a failed write never leaves a partial output behind.
 */
public final class ResultWriter {
  private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

  private ResultWriter() {}

  public static void write(Path output, List<Point> points) throws IOException {
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(points, "points");
    Path target = output.toAbsolutePath();
    Path directory = target.getParent();
    if (directory != null) {
      Files.createDirectories(directory);
    }
    Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        for (Point point : points) {
          writer.write(line(point));
          writer.write('\n');
        }
      }
      move(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
    LOG.info("Output written to {} with {} points", output, points.size());
  }

  static String line(Point point) {
    return format(point.x()) + " " + format(point.y());
  }

  /** Shortest plain decimal form: {@code 6}, {@code 1.5}, {@code -0.25}. */
  static String format(double value) {
    if (value == 0.0) {
      return "0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      LOG.debug("Atomic move unsupported for {}, falling back to replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
