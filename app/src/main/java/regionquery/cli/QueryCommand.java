package regionquery.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.config.StoreConfig;
import regionquery.error.RegionQueryException;
import regionquery.error.Stage;
import regionquery.eval.EvaluationOptions;
import regionquery.eval.QueryExecution;
import regionquery.eval.QueryOutcome;
import regionquery.output.ResultWriter;
import regionquery.query.PredicateNode;
import regionquery.store.PointStore;
import regionquery.store.PointStores;

/** Handles the {@code query} command: description file in, ordered {@code x y} lines out. */
final class QueryCommand {
  private static final Logger LOG = LoggerFactory.getLogger(QueryCommand.class);
  static final Path DEFAULT_OUTPUT = Path.of("output.txt");

  private final StoreConfig baseConfig;

  QueryCommand(StoreConfig baseConfig) {
    this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
  }

  int execute(String[] args) {
    QueryOptions options = parseArgs(args);
    QueryExecution execution = new QueryExecution(options.evaluation());
    Stage stage = Stage.PARSE;
    try {
      PredicateNode tree = execution.build(options.queryFile());
      stage = Stage.LOAD;
      QueryOutcome outcome;
      try (PointStore store = PointStores.open(options.store())) {
        LOG.info("Querying {} ({} points)", options.store().describe(), store.size());
        stage = Stage.EVALUATE;
        outcome = execution.evaluate(tree, store);
      }
      stage = Stage.WRITE;
      ResultWriter.write(options.output(), outcome.points());
      return 0;
    } catch (RegionQueryException ex) {
      LOG.error("Query failed during {} stage: {}", ex.stage().label(), ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("Query failed during {} stage: {}", stage.label(), ex.getMessage());
      return 1;
    }
  }

  QueryOptions parseArgs(String[] args) {
    Path queryFile = null;
    Path output = DEFAULT_OUTPUT;
    Path dataDir = null;
    String jdbcUrl = null;
    String user = null;
    String password = null;
    boolean parallel = false;
    String parallelismRaw = null;

    for (int i = 0; i < args.length; i++) {
      CliParsers.Argument arg = CliParsers.split(args[i]);
      String option = arg.option();
      String inline = arg.inlineValue();
      switch (option) {
        case "--query" ->
            queryFile = Path.of(inline != null ? inline : CliParsers.nextValue(args, ++i, option));
        case "--output" ->
            output = Path.of(inline != null ? inline : CliParsers.nextValue(args, ++i, option));
        case "--data-dir", "--data-directory" ->
            dataDir = Path.of(inline != null ? inline : CliParsers.nextValue(args, ++i, option));
        case "--jdbc-url" ->
            jdbcUrl = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        case "--user" -> user = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        case "--password" ->
            password = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        case "--parallel" -> parallel = true;
        case "--parallelism" -> {
          parallel = true;
          parallelismRaw = inline != null ? inline : CliParsers.nextValue(args, ++i, option);
        }
        default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
    }

    int parallelism = CliParsers.parseInt(parallelismRaw, 0, "--parallelism");
    StoreConfig store = baseConfig.withDataDirectory(dataDir).withJdbc(jdbcUrl, user, password);
    return new QueryOptions(
        queryFile, output, store, new EvaluationOptions(parallel, parallelism));
  }

  record QueryOptions(
      Path queryFile, Path output, StoreConfig store, EvaluationOptions evaluation) {
    QueryOptions {
      if (queryFile == null) {
        throw new IllegalArgumentException("--query <file.json> is required");
      }
      output = output == null ? DEFAULT_OUTPUT : output;
      Objects.requireNonNull(store, "store");
      evaluation = EvaluationOptions.normalize(evaluation);
    }
  }
}
