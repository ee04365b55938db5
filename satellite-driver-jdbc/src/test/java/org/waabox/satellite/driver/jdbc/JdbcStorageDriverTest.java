package org.waabox.satellite.driver.jdbc;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.satellite.SatelliteException;
import org.waabox.satellite.adapter.BatchDatabaseAdapter;
import org.waabox.satellite.adapter.DatabaseAdapter;
import org.waabox.satellite.adapter.SerialDatabaseAdapter;
import org.waabox.satellite.adapter.Statement;

/** Tests for {@link JdbcStorageDriver}.
 *
 * <p>Uses an H2 in-memory database, one per test.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcStorageDriverTest {

  private static final Statement COUNT =
      Statement.of("SELECT COUNT(*) AS total FROM items");

  /** The driver under test. */
  private JdbcStorageDriver driver;

  @BeforeEach
  void setUp() {
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:testdb_" + System.nanoTime()
        + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    driver = new JdbcStorageDriver(JdbcDriverConfig.create(ds));
    driver.exec(Statement.of(
        "CREATE TABLE items (id VARCHAR(20) PRIMARY KEY, v VARCHAR(20))"));
  }

  @AfterEach
  void tearDown() {
    driver.close();
  }

  @Test
  void whenExecuting_givenInsertWithArgs_shouldReportModifiedRows() {
    driver.exec(Statement.of("INSERT INTO items VALUES (?, ?)", "a", "x"));

    assertEquals(1, driver.rowsModified());

    final List<Map<String, Object>> rows = driver.exec(
        Statement.of("SELECT id, v FROM items WHERE id = ?", "a"));

    assertEquals(List.of(Map.of("ID", "a", "V", "x")), rows);
    assertEquals(0, driver.rowsModified());
  }

  @Test
  void whenExecuting_givenNullArgument_shouldBindNull() {
    driver.exec(Statement.of("INSERT INTO items VALUES (?, ?)", "a", null));

    final List<Map<String, Object>> rows = driver.exec(
        Statement.of("SELECT v FROM items WHERE v IS NULL"));

    assertEquals(1, rows.size());
  }

  @Test
  void whenRollingBack_givenOpenTransaction_shouldDiscardChanges() {
    driver.exec(Statement.of("BEGIN"));
    assertTrue(driver.inTransaction());
    driver.exec(Statement.of("INSERT INTO items VALUES ('a', 'x')"));
    driver.exec(Statement.of("ROLLBACK"));

    assertFalse(driver.inTransaction());
    assertEquals(0L, total());
  }

  @Test
  void whenRollingBack_givenFailingRollback_shouldRestoreAutoCommit()
      throws Exception {
    final DataSource dataSource = createMock(DataSource.class);
    final Connection connection = createMock(Connection.class);
    expect(dataSource.getConnection()).andReturn(connection);
    connection.setAutoCommit(true);
    connection.setAutoCommit(false);
    connection.rollback();
    expectLastCall().andThrow(new SQLException("connection reset"));
    connection.setAutoCommit(true);
    replay(dataSource, connection);

    final JdbcStorageDriver broken = new JdbcStorageDriver(
        JdbcDriverConfig.create(dataSource));
    broken.exec(Statement.of("BEGIN"));

    assertThrows(SatelliteException.class,
        () -> broken.exec(Statement.of("ROLLBACK")));
    verify(dataSource, connection);
  }

  @Test
  void whenExecuting_givenInvalidSql_shouldWrapTheError() {
    assertThrows(SatelliteException.class,
        () -> driver.exec(Statement.of("SELECT * FROM missing")));
  }

  @Test
  void whenBatching_givenUniqueViolation_shouldApplyNothing() {
    assertThrows(SatelliteException.class, () -> driver.execBatch(List.of(
        Statement.of("INSERT INTO items VALUES ('a', 'x')"),
        Statement.of("INSERT INTO items VALUES ('a', 'y')"))));

    assertEquals(0L, total());
    assertFalse(driver.inTransaction());
  }

  @Test
  void whenBatching_givenValidStatements_shouldSumModifiedRows() {
    final long rows = driver.execBatch(List.of(
        Statement.of("INSERT INTO items VALUES ('a', 'x')"),
        Statement.of("INSERT INTO items VALUES ('b', 'x')"),
        Statement.of("UPDATE items SET v = 'y'"))).rowsAffected();

    assertEquals(4, rows);
    assertEquals(2L, total());
  }

  @Test
  void whenTransacting_givenUniqueViolation_shouldLeaveTableUnchanged()
      throws Exception {
    final DatabaseAdapter adapter = new SerialDatabaseAdapter(driver);

    final CompletableFuture<Void> result = adapter.<Void>transaction(
        (tx, setResult) -> tx.run(
            Statement.of("INSERT INTO items VALUES (?, ?)", "a", "x"),
            (tx2, res) -> tx2.run(
                Statement.of("INSERT INTO items VALUES (?, ?)", "a", "y"),
                (tx3, res2) -> setResult.accept(null))));

    final ExecutionException error = assertThrows(ExecutionException.class,
        result::get);
    assertTrue(error.getCause() instanceof SatelliteException);
    assertEquals(0L, total());
    assertFalse(driver.inTransaction());
  }

  @Test
  void whenTransacting_givenQueryInside_shouldSeeOwnWrites()
      throws Exception {
    final DatabaseAdapter adapter = new BatchDatabaseAdapter(driver);

    final long seen = adapter.<Long>transaction((tx, setResult) -> {
      tx.run(Statement.of("INSERT INTO items VALUES ('a', 'x')"));
      tx.query(COUNT, (tx2, rows) ->
          setResult.accept(((Number) rows.get(0).get("TOTAL")).longValue()));
    }).get();

    assertEquals(1L, seen);
    assertEquals(1L, total());
  }

  @Test
  void whenRunningInTransaction_givenSerialAdapter_shouldCountOnlyDml()
      throws Exception {
    final DatabaseAdapter adapter = new SerialDatabaseAdapter(driver);

    final long rows = adapter.runInTransaction(
        Statement.of("INSERT INTO items VALUES ('a', 'x')"),
        COUNT,
        Statement.of("UPDATE items SET v = 'y'")).get().rowsAffected();

    assertEquals(2, rows);
  }

  /**
   * Counts the rows of the items table.
   *
   * @return the row count
   */
  private long total() {
    return ((Number) driver.exec(COUNT).get(0).get("TOTAL")).longValue();
  }
}
