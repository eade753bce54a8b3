package com.acme.commands.storage;

import com.acme.commands.registry.CommandEntry;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.UnaryOperator;

/**
 * Process-local associative store of top-level command entries, one entry per name.
 *
 * <p>Every single-key read or write is atomic. {@link #lookup} followed by {@link #insert} is not:
 * callers that need an atomic read-modify-write use {@link #compute}. Tables are created and
 * destroyed by their {@link CommandTableOwner}.
 */
public class CommandTable {
  private final String name;
  private final TableOptions options;
  private final Map<String, CommandEntry> entries;
  private final Thread ownerThread;
  private volatile boolean destroyed;

  CommandTable(String name, TableOptions options) {
    this.name = name;
    this.options = options;
    this.entries = newBackingMap(options);
    this.ownerThread = Thread.currentThread();
  }

  private static Map<String, CommandEntry> newBackingMap(TableOptions options) {
    if (!options.readConcurrency()) {
      return Collections.synchronizedMap(options.orderedKeys() ? new TreeMap<>() : new HashMap<>());
    }
    return options.orderedKeys() ? new ConcurrentSkipListMap<>() : new ConcurrentHashMap<>();
  }

  public String name() {
    return name;
  }

  public TableOptions options() {
    return options;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  public Optional<CommandEntry> lookup(String key) {
    checkAlive();
    return Optional.ofNullable(entries.get(key));
  }

  public void insert(String key, CommandEntry entry) {
    checkWritable();
    entries.put(key, entry);
  }

  public void delete(String key) {
    checkWritable();
    entries.remove(key);
  }

  /**
   * Atomically replaces the entry under {@code key} with {@code remapping} applied to the current
   * entry ({@code null} when absent). Returning {@code null} deletes the key. An exception thrown
   * by {@code remapping} leaves the entry untouched. Ordered tables may apply {@code remapping} more
   * than once under contention, so it must be side-effect free.
   */
  public Optional<CommandEntry> compute(String key, UnaryOperator<CommandEntry> remapping) {
    checkWritable();
    return Optional.ofNullable(entries.compute(key, (k, current) -> remapping.apply(current)));
  }

  /**
   * Copy of every entry, in key order for ordered tables. Built by iteration, so concurrent writes
   * to other keys may or may not be visible.
   */
  public Map<String, CommandEntry> snapshot() {
    checkAlive();
    Map<String, CommandEntry> copy;
    if (entries instanceof ConcurrentSkipListMap || entries instanceof ConcurrentHashMap) {
      copy = new LinkedHashMap<>(entries);
    } else {
      synchronized (entries) {
        copy = new LinkedHashMap<>(entries);
      }
    }
    return Collections.unmodifiableMap(copy);
  }

  public int size() {
    checkAlive();
    return entries.size();
  }

  void destroy() {
    destroyed = true;
    entries.clear();
  }

  private void checkAlive() {
    if (destroyed) {
      throw new TableAccessException("Command table '" + name + "' has been destroyed");
    }
  }

  private void checkWritable() {
    checkAlive();
    if (!options.publiclyWritable() && Thread.currentThread() != ownerThread) {
      throw new TableAccessException(
          "Command table '" + name + "' is only writable by its owner thread " + ownerThread.getName());
    }
  }

  @Override
  public String toString() {
    return "CommandTable{name=" + name + ", options=" + options + "}";
  }
}
