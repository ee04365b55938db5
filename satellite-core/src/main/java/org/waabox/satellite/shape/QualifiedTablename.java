package org.waabox.satellite.shape;

import java.util.Objects;

/**
 * A table name qualified by its namespace (schema).
 *
 * @param namespace the namespace, never null
 * @param tablename the table name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record QualifiedTablename(String namespace, String tablename) {

  /** Compact constructor that validates both parts. */
  public QualifiedTablename {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(tablename, "tablename must not be null");
  }

  @Override
  public String toString() {
    return '"' + namespace + "\".\"" + tablename + '"';
  }
}
