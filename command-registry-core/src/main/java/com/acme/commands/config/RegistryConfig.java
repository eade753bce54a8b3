package com.acme.commands.config;

import com.acme.commands.storage.CommandTableOwner;
import com.acme.commands.storage.TableOptions;
import com.acme.commands.storage.WriteConsistency;

/**
 * Configuration for the command table and how writes reach it. Pure POJO - no framework
 * dependencies.
 */
public class RegistryConfig {

  private String tableName = CommandTableOwner.DEFAULT_TABLE;
  private boolean readConcurrency = true;
  private boolean orderedKeys = true;
  private boolean publiclyWritable = true;
  private boolean globallyNamed = true;
  private WriteConsistency writeConsistency = WriteConsistency.UNSYNCHRONIZED;

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public boolean isReadConcurrency() {
    return readConcurrency;
  }

  public void setReadConcurrency(boolean readConcurrency) {
    this.readConcurrency = readConcurrency;
  }

  public boolean isOrderedKeys() {
    return orderedKeys;
  }

  public void setOrderedKeys(boolean orderedKeys) {
    this.orderedKeys = orderedKeys;
  }

  public boolean isPubliclyWritable() {
    return publiclyWritable;
  }

  public void setPubliclyWritable(boolean publiclyWritable) {
    this.publiclyWritable = publiclyWritable;
  }

  public boolean isGloballyNamed() {
    return globallyNamed;
  }

  public void setGloballyNamed(boolean globallyNamed) {
    this.globallyNamed = globallyNamed;
  }

  public WriteConsistency getWriteConsistency() {
    return writeConsistency;
  }

  public void setWriteConsistency(WriteConsistency writeConsistency) {
    this.writeConsistency = writeConsistency;
  }

  public TableOptions toTableOptions() {
    return new TableOptions(readConcurrency, orderedKeys, publiclyWritable, globallyNamed);
  }

  /** Nested writes can lose updates unless writes are atomic per top-level name. */
  public boolean isLossyWrites() {
    return writeConsistency == WriteConsistency.UNSYNCHRONIZED;
  }
}
