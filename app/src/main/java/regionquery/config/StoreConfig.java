package regionquery.config;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Where the point store lives: either a bulk data directory served from memory, or a JDBC URL. When
 * both are set the data directory wins.
 *
 * <p>{@link #fromEnvironment()} reads system properties first and environment variables second,
 * so a test or a wrapper script can override a shell-level default.
 */
public record StoreConfig(Path dataDirectory, String jdbcUrl, String user, String password) {
  static final String DATA_DIR_PROPERTY = "regionquery.dataDir";
  static final String JDBC_URL_PROPERTY = "regionquery.jdbc.url";
  static final String JDBC_USER_PROPERTY = "regionquery.jdbc.user";
  static final String JDBC_PASSWORD_PROPERTY = "regionquery.jdbc.password";

  static final String DATA_DIR_ENV = "REGIONQUERY_DATA_DIR";
  static final String JDBC_URL_ENV = "REGIONQUERY_JDBC_URL";
  static final String JDBC_USER_ENV = "REGIONQUERY_JDBC_USER";
  static final String JDBC_PASSWORD_ENV = "REGIONQUERY_JDBC_PASSWORD";

  public StoreConfig {
    jdbcUrl = blankToNull(jdbcUrl);
    user = blankToNull(user);
  }

  public static StoreConfig empty() {
    return new StoreConfig(null, null, null, null);
  }

  public static StoreConfig fromEnvironment() {
    return fromLookup(StoreConfig::systemLookup);
  }

  static StoreConfig fromLookup(Function<String, String> lookup) {
    String dataDir = firstNonBlank(lookup.apply(DATA_DIR_PROPERTY), lookup.apply(DATA_DIR_ENV));
    return new StoreConfig(
        dataDir == null ? null : Path.of(dataDir),
        firstNonBlank(lookup.apply(JDBC_URL_PROPERTY), lookup.apply(JDBC_URL_ENV)),
        firstNonBlank(lookup.apply(JDBC_USER_PROPERTY), lookup.apply(JDBC_USER_ENV)),
        firstNonBlank(lookup.apply(JDBC_PASSWORD_PROPERTY), lookup.apply(JDBC_PASSWORD_ENV)));
  }

  public StoreConfig withDataDirectory(Path dataDirectory) {
    return dataDirectory == null ? this : new StoreConfig(dataDirectory, jdbcUrl, user, password);
  }

  public StoreConfig withJdbc(String url, String user, String password) {
    return new StoreConfig(
        dataDirectory,
        url != null ? url : jdbcUrl,
        user != null ? user : this.user,
        password != null ? password : this.password);
  }

  public boolean hasDataDirectory() {
    return dataDirectory != null;
  }

  public boolean hasJdbcUrl() {
    return jdbcUrl != null;
  }

  public String describe() {
    if (hasDataDirectory()) {
      return "data directory " + dataDirectory;
    }
    return hasJdbcUrl() ? "jdbc store" : "no store";
  }

  private static String systemLookup(String key) {
    // property names contain dots, environment names never do
    return key.contains(".") ? System.getProperty(key) : System.getenv(key);
  }

  private static String firstNonBlank(String first, String second) {
    String value = blankToNull(first);
    return value != null ? value : blankToNull(second);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  @Override
  public String toString() {
    return "StoreConfig[" + describe() + "]";
  }
}
