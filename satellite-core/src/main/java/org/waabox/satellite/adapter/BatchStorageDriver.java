package org.waabox.satellite.adapter;

import java.util.List;

/**
 * A {@link StorageDriver} able to execute several statements atomically in
 * a single call.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BatchStorageDriver extends StorageDriver {

  /**
   * Executes all statements in one transaction: either all of them apply or
   * none does.
   *
   * @param statements the statements, never null
   *
   * @return the total number of modified rows, never null
   */
  RunResult execBatch(List<Statement> statements);
}
