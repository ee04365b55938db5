package org.waabox.satellite.shape;

import java.util.List;
import java.util.Objects;

/**
 * A relation pulled into a {@link Shape} through a foreign key.
 *
 * @param foreignKey the foreign key columns, never null or empty
 * @param select     the shape of the related table, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ShapeInclude(List<String> foreignKey, Shape select) {

  /** Compact constructor that validates and copies the foreign key. */
  public ShapeInclude {
    Objects.requireNonNull(foreignKey, "foreignKey must not be null");
    Objects.requireNonNull(select, "select must not be null");
    if (foreignKey.isEmpty()) {
      throw new IllegalArgumentException("foreignKey must not be empty");
    }
    foreignKey = List.copyOf(foreignKey);
  }
}
