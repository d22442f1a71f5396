package regionquery.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import regionquery.error.RegionQueryException;
import regionquery.error.Stage;
import regionquery.error.StoreException;
import regionquery.error.StoreUnavailableException;
import regionquery.model.Box;
import regionquery.model.Point;

/**
 * Point store over the {@code inspection_group} / {@code inspection_region} tables.
 *
 * <p>The store owns one connection for its whole lifetime and keeps it in a single repeatable-read
 * transaction, so every primitive of one query observes the same snapshot. Calls are serialized on
 * that connection. Every value reaches the database as a statement parameter.
 */
public final class JdbcPointStore implements PointStore {
  private static final Logger LOG = LoggerFactory.getLogger(JdbcPointStore.class);

  static final String GROUP_TABLE = "inspection_group";
  static final String REGION_TABLE = "inspection_region";

  private static final String COLUMNS = "id, group_id, coord_x, coord_y, category";
  private static final String RANGE_SCAN =
      "SELECT "
          + COLUMNS
          + " FROM "
          + REGION_TABLE
          + " WHERE coord_x >= ? AND coord_x <= ? AND coord_y >= ? AND coord_y <= ?";
  private static final String BY_GROUP =
      "SELECT " + COLUMNS + " FROM " + REGION_TABLE + " WHERE group_id = ? ORDER BY id";
  private static final String GROUP_IDS =
      "SELECT DISTINCT group_id FROM " + REGION_TABLE + " ORDER BY group_id";
  private static final String CONTAINED_GROUPS =
      "SELECT group_id FROM "
          + REGION_TABLE
          + " GROUP BY group_id"
          + " HAVING MIN(coord_x) >= ? AND MAX(coord_x) <= ?"
          + " AND MIN(coord_y) >= ? AND MAX(coord_y) <= ?"
          + " ORDER BY group_id";
  private static final String COUNT = "SELECT COUNT(*) FROM " + REGION_TABLE;
  private static final String INSERT_GROUP = "INSERT INTO " + GROUP_TABLE + " (id) VALUES (?)";
  private static final String INSERT_REGION =
      "INSERT INTO " + REGION_TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)";

  private static final List<String> SCHEMA =
      List.of(
          "CREATE TABLE IF NOT EXISTS " + GROUP_TABLE + " (id BIGINT NOT NULL, PRIMARY KEY (id))",
          "CREATE TABLE IF NOT EXISTS "
              + REGION_TABLE
              + " (id BIGINT NOT NULL, group_id BIGINT, coord_x DOUBLE PRECISION,"
              + " coord_y DOUBLE PRECISION, category INTEGER, PRIMARY KEY (id))",
          "CREATE INDEX IF NOT EXISTS inspection_region_xy ON "
              + REGION_TABLE
              + " (coord_x, coord_y)",
          "CREATE INDEX IF NOT EXISTS inspection_region_group ON " + REGION_TABLE + " (group_id)");

  private static final int BATCH_SIZE = 1_000;

  private final Connection connection;

  private JdbcPointStore(Connection connection) throws SQLException {
    this.connection = Objects.requireNonNull(connection, "connection");
    connection.setAutoCommit(false);
    connection.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
  }

  /** Opens a connection; failures are reported against {@code stage}. */
  public static JdbcPointStore connect(String url, String user, String password, Stage stage) {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(stage, "stage");
    Connection connection = null;
    try {
      connection = DriverManager.getConnection(url, user, password);
      LOG.info("Connected to point store {}", redact(url));
      return new JdbcPointStore(connection);
    } catch (SQLException ex) {
      closeQuietly(connection);
      throw new StoreUnavailableException(
          stage, "Cannot connect to " + redact(url) + ": " + ex.getMessage(), ex);
    }
  }

  /** Wraps a connection the caller already opened; the store takes ownership of it. */
  public static JdbcPointStore wrap(Connection connection) {
    try {
      return new JdbcPointStore(connection);
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "configure connection", ex);
    }
  }

  /** Creates the tables and indexes when they do not exist yet. */
  public synchronized void createSchema() {
    try (Statement statement = connection.createStatement()) {
      for (String ddl : SCHEMA) {
        statement.execute(ddl);
      }
      connection.commit();
      LOG.debug("Schema verified");
    } catch (SQLException ex) {
      rollback();
      throw translate(Stage.LOAD, "create schema", ex);
    }
  }

  /**
   * Inserts the dataset in one transaction. Groups and points whose ids already exist are left
   * untouched.
   *
   * @return number of points inserted
   */
  public synchronized int load(Dataset dataset) {
    Objects.requireNonNull(dataset, "dataset");
    createSchema();
    try {
      Set<Long> knownGroups = ids("SELECT id FROM " + GROUP_TABLE);
      Set<Long> knownPoints = ids("SELECT id FROM " + REGION_TABLE);

      int groupsInserted = 0;
      try (PreparedStatement insert = connection.prepareStatement(INSERT_GROUP)) {
        for (long groupId : dataset.groupIds()) {
          if (knownGroups.add(groupId)) {
            insert.setLong(1, groupId);
            insert.addBatch();
            groupsInserted++;
          }
        }
        insert.executeBatch();
      }

      int pointsInserted = 0;
      try (PreparedStatement insert = connection.prepareStatement(INSERT_REGION)) {
        for (Point point : dataset.points()) {
          if (!knownPoints.add(point.id())) {
            continue;
          }
          insert.setLong(1, point.id());
          insert.setLong(2, point.groupId());
          insert.setDouble(3, point.x());
          insert.setDouble(4, point.y());
          insert.setInt(5, point.category());
          insert.addBatch();
          if (++pointsInserted % BATCH_SIZE == 0) {
            insert.executeBatch();
          }
        }
        insert.executeBatch();
      }
      connection.commit();
      LOG.info(
          "Loaded {} points and {} groups ({} points already present)",
          pointsInserted,
          groupsInserted,
          dataset.size() - pointsInserted);
      return pointsInserted;
    } catch (SQLException ex) {
      rollback();
      throw translate(Stage.LOAD, "load dataset", ex);
    }
  }

  @Override
  public synchronized Set<Point> rangeScan(Box box, OptionalInt category, Set<Long> groupIds) {
    Objects.requireNonNull(box, "box");
    Set<Long> groups = groupIds == null ? Set.of() : groupIds;
    StringBuilder sql = new StringBuilder(RANGE_SCAN);
    if (category.isPresent()) {
      sql.append(" AND category = ?");
    }
    if (!groups.isEmpty()) {
      sql.append(" AND group_id IN (")
          .append(String.join(", ", Collections.nCopies(groups.size(), "?")))
          .append(')');
    }
    sql.append(" ORDER BY id");

    try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
      int index = bindBox(statement, 1, box);
      if (category.isPresent()) {
        statement.setInt(index++, category.getAsInt());
      }
      for (long groupId : groups) {
        statement.setLong(index++, groupId);
      }
      Set<Point> points = readPoints(statement);
      LOG.debug("rangeScan {} -> {} points", box, points.size());
      return points;
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "range scan", ex);
    }
  }

  @Override
  public synchronized Set<Point> pointsByGroup(long groupId) {
    try (PreparedStatement statement = connection.prepareStatement(BY_GROUP)) {
      statement.setLong(1, groupId);
      return readPoints(statement);
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "read group " + groupId, ex);
    }
  }

  @Override
  public synchronized Set<Long> groupIds() {
    try {
      return ids(GROUP_IDS);
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "list groups", ex);
    }
  }

  @Override
  public synchronized Set<Long> fullyContainedGroups(Box box) {
    Objects.requireNonNull(box, "box");
    try (PreparedStatement statement = connection.prepareStatement(CONTAINED_GROUPS)) {
      bindBox(statement, 1, box);
      Set<Long> groups = new LinkedHashSet<>();
      try (ResultSet rows = statement.executeQuery()) {
        while (rows.next()) {
          groups.add(rows.getLong(1));
        }
      }
      LOG.debug("fullyContainedGroups {} -> {} groups", box, groups.size());
      return groups;
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "containment check", ex);
    }
  }

  @Override
  public synchronized long size() {
    try (PreparedStatement statement = connection.prepareStatement(COUNT);
        ResultSet rows = statement.executeQuery()) {
      return rows.next() ? rows.getLong(1) : 0L;
    } catch (SQLException ex) {
      throw translate(Stage.EVALUATE, "count points", ex);
    }
  }

  @Override
  public synchronized void close() {
    try {
      if (!connection.isClosed()) {
        connection.rollback();
        connection.close();
      }
    } catch (SQLException ex) {
      LOG.warn("Failed to close point store connection cleanly: {}", ex.getMessage());
    }
  }

  private static int bindBox(PreparedStatement statement, int start, Box box)
      throws SQLException {
    statement.setDouble(start, box.minX());
    statement.setDouble(start + 1, box.maxX());
    statement.setDouble(start + 2, box.minY());
    statement.setDouble(start + 3, box.maxY());
    return start + 4;
  }

  private static Set<Point> readPoints(PreparedStatement statement) throws SQLException {
    Set<Point> points = new LinkedHashSet<>();
    try (ResultSet rows = statement.executeQuery()) {
      while (rows.next()) {
        points.add(
            new Point(
                rows.getLong("id"),
                rows.getLong("group_id"),
                rows.getDouble("coord_x"),
                rows.getDouble("coord_y"),
                rows.getInt("category")));
      }
    }
    return points;
  }

  private Set<Long> ids(String sql) throws SQLException {
    Set<Long> ids = new LinkedHashSet<>();
    try (PreparedStatement statement = connection.prepareStatement(sql);
        ResultSet rows = statement.executeQuery()) {
      while (rows.next()) {
        ids.add(rows.getLong(1));
      }
    }
    return ids;
  }

  private void rollback() {
    try {
      connection.rollback();
    } catch (SQLException ex) {
      LOG.warn("Rollback failed: {}", ex.getMessage());
    }
  }

  static RegionQueryException translate(Stage stage, String action, SQLException ex) {
    String message = "Point store failed to " + action + ": " + ex.getMessage();
    if (isConnectionFailure(ex)) {
      return new StoreUnavailableException(stage, message, ex);
    }
    return new StoreException(stage, message, ex);
  }

  static boolean isConnectionFailure(SQLException ex) {
    if (ex instanceof SQLTransientConnectionException
        || ex instanceof SQLNonTransientConnectionException) {
      return true;
    }
    String state = ex.getSQLState();
    return state != null && state.startsWith("08");
  }

  private static void closeQuietly(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      LOG.debug("Ignoring close failure after connect error: {}", ex.getMessage());
    }
  }

  /** Drops any {@code password=...} parameter before a URL is logged. */
  static String redact(String url) {
    return url.replaceAll("(?i)(password=)[^&;]*", "$1***");
  }
}
