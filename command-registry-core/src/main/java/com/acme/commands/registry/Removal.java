package com.acme.commands.registry;

/** Outcome of removing a nested path from a top-level entry. */
public sealed interface Removal {

  /** Some name along the path does not exist; nothing to write. */
  record Unchanged() implements Removal {}

  /** The top-level entry must be replaced by {@code group}, which is never empty. */
  record Pruned(CommandGroup group) implements Removal {}

  /** Nothing is left under the top-level name; the key must be deleted. */
  record Emptied() implements Removal {}

  Removal UNCHANGED = new Unchanged();
  Removal EMPTIED = new Emptied();

  static Removal of(CommandGroup remaining) {
    return remaining.isEmpty() ? EMPTIED : new Pruned(remaining);
  }
}
