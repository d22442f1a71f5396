package regionquery.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.config.StoreConfig;
import regionquery.error.RegionQueryException;
import regionquery.error.Stage;
import regionquery.store.Dataset;
import regionquery.store.DatasetLoader;
import regionquery.store.JdbcPointStore;

/** Handles the {@code load} command: bulk data directory into the JDBC schema. */
final class LoadCommand {
  private static final Logger LOG = LoggerFactory.getLogger(LoadCommand.class);

  private final StoreConfig baseConfig;

  LoadCommand(StoreConfig baseConfig) {
    this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
  }

  int execute(String[] args) {
    LoadOptions options = parseArgs(args);
    try {
      Dataset dataset = DatasetLoader.load(options.dataDirectory());
      StoreConfig store = options.store();
      try (JdbcPointStore target =
          JdbcPointStore.connect(store.jdbcUrl(), store.user(), store.password(), Stage.LOAD)) {
        int inserted = target.load(dataset);
        LOG.info("Data loading completed: {} of {} points inserted", inserted, dataset.size());
      }
      return 0;
    } catch (RegionQueryException ex) {
      LOG.error("Load failed during {} stage: {}", ex.stage().label(), ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("Load failed during {} stage: {}", Stage.LOAD.label(), ex.getMessage());
      return 1;
    }
  }

  LoadOptions parseArgs(String[] args) {
    Path dataDir = null;
    String jdbcUrl = null;
    String user = null;
    String password = null;

    for (int i = 0; i < args.length; i++) {
      CliParsers.Argument arg = CliParsers.split(args[i]);
      String option = arg.option();
      String inline = arg.inlineValue();
      switch (option) {
        case "--data-directory", "--data-dir", "--data_directory" ->
            dataDir = Path.of(inline != null ? inline : CliParsers.nextValue(args, ++i, option));
        case "--jdbc-url" ->
            jdbcUrl = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        case "--user" -> user = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        case "--password" ->
            password = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
    }
    StoreConfig store = baseConfig.withJdbc(jdbcUrl, user, password);
    Path directory = dataDir != null ? dataDir : baseConfig.dataDirectory();
    return new LoadOptions(directory, store);
  }

  record LoadOptions(Path dataDirectory, StoreConfig store) {
    LoadOptions {
      if (dataDirectory == null) {
        throw new IllegalArgumentException("--data-directory <path> is required");
      }
      if (store == null || !store.hasJdbcUrl()) {
        throw new IllegalArgumentException("--jdbc-url <url> is required");
      }
    }
  }
}
