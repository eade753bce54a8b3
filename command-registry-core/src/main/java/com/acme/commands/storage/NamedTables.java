package com.acme.commands.storage;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-wide directory of globally named command tables. */
public final class NamedTables {
  private static final ConcurrentMap<String, CommandTable> TABLES = new ConcurrentHashMap<>();

  private NamedTables() {}

  public static Optional<CommandTable> lookup(String name) {
    return Optional.ofNullable(TABLES.get(name));
  }

  public static boolean isRegistered(String name) {
    return TABLES.containsKey(name);
  }

  static void register(CommandTable table) {
    if (TABLES.putIfAbsent(table.name(), table) != null) {
      throw new TableAlreadyExistsException(table.name());
    }
  }

  static void unregister(CommandTable table) {
    TABLES.remove(table.name(), table);
  }
}
