package org.waabox.satellite.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A description of a filtered subset of a server-side table that a client
 * subscribes to.
 *
 * <p>The {@code where} clause is kept opaque: it is compared as text and
 * forwarded untouched to the upstream. Related tables are pulled in through
 * {@link ShapeInclude} entries, whose order is irrelevant for equality
 * purposes (see {@link ShapeHasher}).
 *
 * @param tablename the name of the table, never null or blank
 * @param where     the optional filter clause, may be null
 * @param include   the related shapes to include, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Shape(String tablename, String where, List<ShapeInclude> include) {

  /**
   * Compact constructor that validates the table name and copies the
   * includes.
   */
  public Shape {
    Objects.requireNonNull(tablename, "tablename must not be null");
    if (tablename.isBlank()) {
      throw new IllegalArgumentException("tablename must not be blank");
    }
    include = include == null ? List.of() : List.copyOf(include);
  }

  /**
   * Creates a shape selecting a whole table.
   *
   * @param tablename the table name, never null
   *
   * @return the shape, never null
   */
  public static Shape of(final String tablename) {
    return new Shape(tablename, null, List.of());
  }

  /**
   * Creates a shape selecting the rows of a table matching a filter.
   *
   * @param tablename the table name, never null
   * @param where     the filter clause, may be null
   *
   * @return the shape, never null
   */
  public static Shape of(final String tablename, final String where) {
    return new Shape(tablename, where, List.of());
  }

  /**
   * Returns a copy of this shape that also includes the given relation.
   *
   * @param foreignKey the foreign key columns linking both tables, never null
   * @param select     the related shape, never null
   *
   * @return a new shape, never null
   */
  public Shape including(final List<String> foreignKey, final Shape select) {
    final List<ShapeInclude> includes = new ArrayList<>(include);
    includes.add(new ShapeInclude(foreignKey, select));
    return new Shape(tablename, where, includes);
  }
}
