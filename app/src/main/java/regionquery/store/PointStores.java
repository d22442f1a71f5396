package regionquery.store;

import java.io.IOException;
import java.util.Objects;
import regionquery.config.StoreConfig;
import regionquery.error.Stage;

/** Opens the store a {@link StoreConfig} points at. */
public final class PointStores {
  private PointStores() {}

  /**
   * @throws IllegalArgumentException if the configuration names no store
   */
  public static PointStore open(StoreConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    if (config.hasDataDirectory()) {
      return InMemoryPointStore.of(DatasetLoader.load(config.dataDirectory()));
    }
    if (config.hasJdbcUrl()) {
      return JdbcPointStore.connect(
          config.jdbcUrl(), config.user(), config.password(), Stage.EVALUATE);
    }
    throw new IllegalArgumentException(
        "No point store configured: pass --data-dir or --jdbc-url, or set REGIONQUERY_DATA_DIR /"
            + " REGIONQUERY_JDBC_URL");
  }
}
