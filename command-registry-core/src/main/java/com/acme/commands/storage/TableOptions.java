package com.acme.commands.storage;

/**
 * Shape of a {@link CommandTable}.
 *
 * @param readConcurrency lock-free concurrent reads; when off, a single lock guards the table
 * @param orderedKeys iterate keys in natural string order
 * @param publiclyWritable any thread may write; when off, only the creating thread may
 * @param globallyNamed register the table in {@link NamedTables} so it can be resolved by name
 */
public record TableOptions(
    boolean readConcurrency, boolean orderedKeys, boolean publiclyWritable, boolean globallyNamed) {

  private static final TableOptions DEFAULTS = new TableOptions(true, true, true, true);

  public static TableOptions defaults() {
    return DEFAULTS;
  }

  public TableOptions withGloballyNamed(boolean globallyNamed) {
    return new TableOptions(readConcurrency, orderedKeys, publiclyWritable, globallyNamed);
  }

  public TableOptions withPubliclyWritable(boolean publiclyWritable) {
    return new TableOptions(readConcurrency, orderedKeys, publiclyWritable, globallyNamed);
  }
}
