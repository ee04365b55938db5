package org.waabox.satellite.adapter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A SQL statement with its positional arguments.
 *
 * <p>Arguments may contain nulls, so they are copied into an unmodifiable
 * list rather than through {@link List#copyOf}.
 *
 * @param sql  the SQL text, never null
 * @param args the positional arguments, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Statement(String sql, List<Object> args) {

  /** Compact constructor that validates the SQL and copies the args. */
  public Statement {
    Objects.requireNonNull(sql, "sql must not be null");
    args = args == null ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(args));
  }

  /**
   * Creates a statement.
   *
   * @param sql  the SQL text, never null
   * @param args the positional arguments
   *
   * @return the statement, never null
   */
  public static Statement of(final String sql, final Object... args) {
    return new Statement(sql, Arrays.asList(args));
  }
}
