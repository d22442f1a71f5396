package regionquery.cli;

import com.google.common.base.Splitter;
import java.util.List;

/** Shared helpers for command-line parsing. */
final class CliParsers {
  private static final Splitter OPTION_VALUE = Splitter.on('=').limit(2);

  private CliParsers() {}

  /** Splits {@code --opt=value} into its two halves; a bare option yields a null value. */
  static Argument split(String raw) {
    if (!raw.startsWith("--")) {
      return new Argument(raw, null);
    }
    List<String> parts = OPTION_VALUE.splitToList(raw);
    if (parts.size() == 1 || parts.get(1).isEmpty()) {
      return new Argument(parts.get(0), null);
    }
    return new Argument(parts.get(0), parts.get(1));
  }

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  record Argument(String option, String inlineValue) {}
}
