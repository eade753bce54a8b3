package com.acme.commands.storage;

import com.acme.commands.registry.CommandEntry;
import com.acme.commands.registry.CommandGroup;
import com.acme.commands.registry.CommandPath;
import com.acme.commands.registry.CommandRef;
import com.acme.commands.registry.LeafCollisionException;
import com.acme.commands.registry.PathMutator;
import com.acme.commands.registry.Removal;
import com.acme.commands.spi.CommandStorage;
import com.acme.commands.spi.StorageResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandStorage} backed by a {@link CommandTable}. Nested paths are resolved by {@link
 * PathMutator} inside the value of the top-level name, which is then written back as a whole.
 */
public class TableCommandStorage implements CommandStorage {
  private static final Logger log = LoggerFactory.getLogger(TableCommandStorage.class);

  private final CommandTable table;
  private final WriteConsistency consistency;

  public TableCommandStorage(CommandTable table) {
    this(table, WriteConsistency.UNSYNCHRONIZED);
  }

  public TableCommandStorage(CommandTable table, WriteConsistency consistency) {
    this.table = table;
    this.consistency = consistency;
  }

  /** Storage over the globally named table {@value CommandTableOwner#DEFAULT_TABLE}. */
  public static TableCommandStorage forDefaultTable() {
    return forNamedTable(CommandTableOwner.DEFAULT_TABLE);
  }

  /**
   * @throws IllegalStateException if no globally named table called {@code tableName} is running
   */
  public static TableCommandStorage forNamedTable(String tableName) {
    CommandTable named =
        NamedTables.lookup(tableName)
            .orElseThrow(
                () -> new IllegalStateException("No command table named '" + tableName + "'"));
    return new TableCommandStorage(named);
  }

  public CommandTable getTable() {
    return table;
  }

  public WriteConsistency getConsistency() {
    return consistency;
  }

  @Override
  public StorageResult addCommand(List<String> segments, CommandRef ref) {
    CommandPath path = CommandPath.of(segments);
    if (path.isTopLevel()) {
      table.insert(path.head(), ref);
      log.info("Registered command `{}` in table '{}'", path, table.name());
      return StorageResult.ok();
    }

    try {
      if (consistency == WriteConsistency.PER_KEY_ATOMIC) {
        table.compute(path.head(), current -> PathMutator.insert(current, path, ref));
      } else {
        CommandEntry current = table.lookup(path.head()).orElse(null);
        CommandGroup updated = PathMutator.insert(current, path, ref);
        table.insert(path.head(), updated);
      }
    } catch (LeafCollisionException e) {
      log.warn("Rejected command `{}` in table '{}': {}", path, table.name(), e.getMessage());
      return StorageResult.error(e.getCollision());
    }
    log.info("Registered command `{}` in table '{}'", path, table.name());
    return StorageResult.ok();
  }

  @Override
  public StorageResult removeCommand(List<String> segments) {
    CommandPath path = CommandPath.of(segments);
    if (path.isTopLevel()) {
      table.delete(path.head());
      log.debug("Removed command `{}` from table '{}'", path, table.name());
      return StorageResult.ok();
    }

    try {
      if (consistency == WriteConsistency.PER_KEY_ATOMIC) {
        table.compute(path.head(), current -> applyRemoval(current, path));
      } else {
        CommandEntry current = table.lookup(path.head()).orElse(null);
        Removal removal = PathMutator.remove(current, path);
        if (removal instanceof Removal.Pruned pruned) {
          table.insert(path.head(), pruned.group());
        } else if (removal instanceof Removal.Emptied) {
          table.delete(path.head());
        }
      }
    } catch (LeafCollisionException e) {
      log.warn("Rejected removal of `{}` in table '{}': {}", path, table.name(), e.getMessage());
      return StorageResult.error(e.getCollision());
    }
    log.debug("Removed command `{}` from table '{}'", path, table.name());
    return StorageResult.ok();
  }

  private static CommandEntry applyRemoval(CommandEntry current, CommandPath path) {
    Removal removal = PathMutator.remove(current, path);
    if (removal instanceof Removal.Pruned pruned) {
      return pruned.group();
    }
    if (removal instanceof Removal.Emptied) {
      return null;
    }
    return current;
  }

  @Override
  public Optional<CommandEntry> lookupCommand(String name) {
    return table.lookup(name);
  }

  @Override
  public Map<String, CommandEntry> allCommands() {
    return table.snapshot();
  }
}
