package regionquery.store;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.error.InputNotFoundException;
import regionquery.error.Stage;
import regionquery.model.Point;

/**
 * Reads the bulk data directory format: {@code points.txt} ({@code x y}), {@code categories.txt}
 * and {@code groups.txt}, one value per line. Line {@code i} of each file describes the same point,
 * whose id is its 1-based position. Blank lines are skipped.
 */
public final class DatasetLoader {
  private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

  public static final String POINTS_FILE = "points.txt";
  public static final String CATEGORIES_FILE = "categories.txt";
  public static final String GROUPS_FILE = "groups.txt";

  private static final Splitter FIELDS =
      Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();

  private DatasetLoader() {}

  public static Dataset load(Path directory) throws IOException {
    Objects.requireNonNull(directory, "directory");
    if (!Files.isDirectory(directory)) {
      throw new InputNotFoundException(Stage.LOAD, directory);
    }
    List<double[]> coordinates =
        readLines(directory.resolve(POINTS_FILE), DatasetLoader::coordinate);
    List<Integer> categories = readLines(directory.resolve(CATEGORIES_FILE), Integer::parseInt);
    List<Long> groups = readLines(directory.resolve(GROUPS_FILE), Long::parseLong);

    if (coordinates.size() != categories.size() || coordinates.size() != groups.size()) {
      throw new IOException(
          "Data files have different numbers of lines in "
              + directory
              + ": points="
              + coordinates.size()
              + ", categories="
              + categories.size()
              + ", groups="
              + groups.size());
    }

    List<Point> points = new ArrayList<>(coordinates.size());
    for (int i = 0; i < coordinates.size(); i++) {
      double[] xy = coordinates.get(i);
      points.add(new Point(i + 1L, groups.get(i), xy[0], xy[1], categories.get(i)));
    }
    LOG.info("Read {} points from {}", points.size(), directory);
    return new Dataset(points);
  }

  private static <T> List<T> readLines(Path file, Function<String, T> parser) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new InputNotFoundException(Stage.LOAD, file);
    }
    List<T> values = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        try {
          values.add(parser.apply(trimmed));
        } catch (IllegalArgumentException ex) {
          throw new IOException(
              "Invalid value at " + file.getFileName() + ":" + lineNumber + ": '" + trimmed + "'",
              ex);
        }
      }
    }
    LOG.debug("Read {} values from {}", values.size(), file);
    return values;
  }

  private static double[] coordinate(String line) {
    List<String> fields = FIELDS.splitToList(line);
    if (fields.size() != 2) {
      throw new IllegalArgumentException("expected 'x y' but found " + fields.size() + " fields");
    }
    double x = Double.parseDouble(fields.get(0));
    double y = Double.parseDouble(fields.get(1));
    if (!Double.isFinite(x) || !Double.isFinite(y)) {
      throw new IllegalArgumentException("coordinates must be finite");
    }
    return new double[] {x, y};
  }
}
