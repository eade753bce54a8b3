package com.acme.commands.registry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Immutable named collection of entries. Every mutator returns a new group; children iterate in
 * name order.
 */
public record CommandGroup(Map<String, CommandEntry> children) implements CommandEntry {

  private static final CommandGroup EMPTY = new CommandGroup(Map.of());

  public CommandGroup {
    Objects.requireNonNull(children, "children");
    children = Collections.unmodifiableMap(new TreeMap<>(children));
  }

  public static CommandGroup empty() {
    return EMPTY;
  }

  public static CommandGroup of(String name, CommandEntry entry) {
    return new CommandGroup(Map.of(name, entry));
  }

  public static CommandGroup of(Map<String, ? extends CommandEntry> children) {
    return new CommandGroup(Map.copyOf(children));
  }

  public Optional<CommandEntry> get(String name) {
    return Optional.ofNullable(children.get(name));
  }

  public int size() {
    return children.size();
  }

  public boolean isEmpty() {
    return children.isEmpty();
  }

  /** Returns a copy with {@code name} bound to {@code entry}, replacing any previous binding. */
  public CommandGroup with(String name, CommandEntry entry) {
    TreeMap<String, CommandEntry> copy = new TreeMap<>(children);
    copy.put(name, entry);
    return new CommandGroup(copy);
  }

  public CommandGroup without(String name) {
    if (!children.containsKey(name)) {
      return this;
    }
    TreeMap<String, CommandEntry> copy = new TreeMap<>(children);
    copy.remove(name);
    return new CommandGroup(copy);
  }

  /** Returns a copy holding only the children accepted by {@code keep}. */
  public CommandGroup retain(Predicate<CommandEntry> keep) {
    TreeMap<String, CommandEntry> copy = new TreeMap<>();
    children.forEach(
        (name, entry) -> {
          if (keep.test(entry)) {
            copy.put(name, entry);
          }
        });
    return copy.size() == children.size() ? this : new CommandGroup(copy);
  }
}
