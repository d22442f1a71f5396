package regionquery.cli;

import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.config.StoreConfig;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code query --query q.json [--output out.txt] (--data-dir dir | --jdbc-url url)
 *       [--user u] [--password p] [--parallel | --parallelism n]}
 *   <li>{@code load --data-directory dir --jdbc-url url [--user u] [--password p]}
 * </ul>
 *
 * <p>Starting with an option instead of a command runs {@code query}. Exit status is 0 on success
 * and 1 on any failure.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage:",
          "  region-query query --query <file.json> [--output <file.txt>]"
              + " (--data-dir <dir> | --jdbc-url <url>) [--user <u>] [--password <p>]"
              + " [--parallel | --parallelism <n>]",
          "  region-query load --data-directory <dir> --jdbc-url <url>"
              + " [--user <u>] [--password <p>]");

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, StoreConfig.fromEnvironment()));
  }

  static int run(String[] args, StoreConfig config) {
    if (args == null || args.length == 0) {
      System.err.println(USAGE);
      return 1;
    }
    String first = args[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      return switch (first) {
        case "query" -> new QueryCommand(config).execute(rest);
        case "load" -> new LoadCommand(config).execute(rest);
        case "help", "--help", "-h" -> {
          System.out.println(USAGE);
          yield 0;
        }
        default -> {
          if (first.startsWith("--")) {
            yield new QueryCommand(config).execute(args);
          }
          throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      System.err.println(USAGE);
      return 1;
    }
  }
}
