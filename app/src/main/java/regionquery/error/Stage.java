package regionquery.error;

import java.util.Locale;

/** Step of a command in which a failure was raised. */
public enum Stage {
  LOAD,
  PARSE,
  BUILD,
  EVALUATE,
  WRITE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
