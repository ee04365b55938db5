package org.waabox.satellite.driver.jdbc;

import java.time.Duration;
import java.util.Objects;

import javax.sql.DataSource;

/**
 * Configuration for the {@link JdbcStorageDriver}.
 *
 * <p>Holds the {@link DataSource} the driver takes its connection from and
 * the timeout applied to every statement.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and {@link #create(DataSource, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcDriverConfig {

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The statement timeout, {@link Duration#ZERO} for none. */
  private final Duration queryTimeout;

  /** Private constructor; use static factories.
   *
   * @param theDataSource   the JDBC data source
   * @param theQueryTimeout the statement timeout
   */
  private JdbcDriverConfig(final DataSource theDataSource,
      final Duration theQueryTimeout) {
    dataSource = theDataSource;
    queryTimeout = theQueryTimeout;
  }

  /**
   * Creates a configuration with a statement timeout.
   *
   * @param dataSource   the JDBC data source, never null
   * @param queryTimeout the statement timeout, never null or negative;
   *                     {@link Duration#ZERO} disables it
   *
   * @return a new configuration instance, never null
   */
  public static JdbcDriverConfig create(final DataSource dataSource,
      final Duration queryTimeout) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(queryTimeout, "queryTimeout cannot be null");

    if (queryTimeout.isNegative()) {
      throw new IllegalArgumentException("queryTimeout cannot be negative");
    }

    return new JdbcDriverConfig(dataSource, queryTimeout);
  }

  /**
   * Creates a configuration without statement timeout.
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcDriverConfig create(final DataSource dataSource) {
    return create(dataSource, Duration.ZERO);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the statement timeout.
   *
   * @return the timeout, {@link Duration#ZERO} when disabled
   */
  public Duration queryTimeout() {
    return queryTimeout;
  }
}
