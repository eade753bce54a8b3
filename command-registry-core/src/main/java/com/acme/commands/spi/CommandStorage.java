package com.acme.commands.spi;

import com.acme.commands.registry.CommandEntry;
import com.acme.commands.registry.CommandRef;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for command handlers addressed by path. Implementations are bound to one table handle.
 */
public interface CommandStorage {

  /**
   * Register {@code ref} at {@code path}. A single-segment path replaces whatever is stored under
   * that name; a longer path creates missing groups on the way.
   *
   * @return an error result if the path runs through an existing command
   * @throws IllegalArgumentException if {@code path} is empty or holds an empty segment
   */
  StorageResult addCommand(List<String> path, CommandRef ref);

  /**
   * Remove the entry at {@code path} and prune groups left empty. Removing a missing path is a
   * successful no-op.
   *
   * @return an error result if the path runs through an existing command
   */
  StorageResult removeCommand(List<String> path);

  /** The command or full group stored under the top-level {@code name}. */
  Optional<CommandEntry> lookupCommand(String name);

  /** Snapshot of every top-level entry. */
  Map<String, CommandEntry> allCommands();
}
