package com.acme.commands.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and owns a {@link CommandTable}. The table lives exactly as long as its owner: {@link
 * #stop()} destroys it together with every entry.
 *
 * <p>The owner is not involved in reads or writes. Callers fetch the handle once through {@link
 * #getTableHandle()} and work against the table directly.
 */
public final class CommandTableOwner implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CommandTableOwner.class);

  public static final String DEFAULT_TABLE = "commands";

  private volatile CommandTable table;

  private CommandTableOwner(CommandTable table) {
    this.table = table;
  }

  public static CommandTableOwner start() {
    return start(DEFAULT_TABLE, TableOptions.defaults());
  }

  public static CommandTableOwner start(String tableName) {
    return start(tableName, TableOptions.defaults());
  }

  /**
   * Create an empty table.
   *
   * @throws TableAlreadyExistsException if {@code options} ask for a global name that is taken
   */
  public static CommandTableOwner start(String tableName, TableOptions options) {
    CommandTable created = new CommandTable(tableName, options);
    if (options.globallyNamed()) {
      NamedTables.register(created);
    }
    log.info("Started command table '{}' with {}", tableName, options);
    return new CommandTableOwner(created);
  }

  /**
   * @throws IllegalStateException once the owner has been stopped
   */
  public CommandTable getTableHandle() {
    CommandTable current = table;
    if (current == null) {
      throw new IllegalStateException("Command table owner has been stopped");
    }
    return current;
  }

  public boolean isRunning() {
    return table != null;
  }

  public synchronized void stop() {
    CommandTable current = table;
    if (current == null) {
      return;
    }
    table = null;
    if (current.options().globallyNamed()) {
      NamedTables.unregister(current);
    }
    current.destroy();
    log.info("Stopped command table '{}'", current.name());
  }

  @Override
  public void close() {
    stop();
  }
}
