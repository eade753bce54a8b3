package com.acme.commands.registry;

/**
 * Insert/remove of nested paths inside a single top-level entry. Pure functions: the input entry is
 * never modified and nothing is written anywhere, callers commit the returned value.
 *
 * <p>Paths given here always carry their top-level name as the first segment and have at least two
 * segments; single-segment paths are table-level operations.
 */
public final class PathMutator {

  private PathMutator() {}

  /**
   * Place {@code ref} at {@code path} below the top-level entry, creating missing groups.
   *
   * @param topLevel the current entry stored under {@code path.head()}, or {@code null} if absent
   * @return the new top-level group to store
   * @throws LeafCollisionException if a command sits where a group is needed
   */
  public static CommandGroup insert(CommandEntry topLevel, CommandPath path, CommandRef ref) {
    requireNested(path);
    return insertAt(asGroup(topLevel, path, 0, "add"), path, 1, ref);
  }

  private static CommandGroup insertAt(
      CommandGroup group, CommandPath path, int depth, CommandRef ref) {
    String name = path.segment(depth);
    if (path.isLast(depth)) {
      return group.with(name, ref);
    }
    CommandGroup child = asGroup(group.get(name).orElse(null), path, depth, "add");
    return group.with(name, insertAt(child, path, depth + 1, ref));
  }

  /**
   * Remove the entry at {@code path}, pruning every group left without commands on the way back up.
   *
   * @param topLevel the current entry stored under {@code path.head()}, or {@code null} if absent
   * @throws LeafCollisionException if a command sits where a group is needed
   */
  public static Removal remove(CommandEntry topLevel, CommandPath path) {
    requireNested(path);
    if (topLevel == null) {
      return Removal.UNCHANGED;
    }
    return removeAt(asGroup(topLevel, path, 0, "remove"), path, 1);
  }

  private static Removal removeAt(CommandGroup group, CommandPath path, int depth) {
    String name = path.segment(depth);
    CommandEntry child = group.get(name).orElse(null);
    if (child == null) {
      return Removal.UNCHANGED;
    }

    CommandGroup remaining;
    if (path.isLast(depth)) {
      remaining = group.without(name);
    } else {
      Removal nested = removeAt(asGroup(child, path, depth, "remove"), path, depth + 1);
      if (nested instanceof Removal.Pruned pruned) {
        remaining = group.with(name, pruned.group());
      } else if (nested instanceof Removal.Emptied) {
        remaining = group.without(name);
      } else {
        return Removal.UNCHANGED;
      }
    }
    return Removal.of(remaining.retain(entry -> !isEmpty(entry)));
  }

  /**
   * A command is never empty; a group is empty when every entry in it is empty. An empty group, or
   * one that only holds empty groups, therefore counts as empty.
   */
  public static boolean isEmpty(CommandEntry entry) {
    if (entry instanceof CommandGroup group) {
      return group.children().values().stream().allMatch(PathMutator::isEmpty);
    }
    return false;
  }

  private static CommandGroup asGroup(
      CommandEntry entry, CommandPath path, int depth, String operation) {
    if (entry == null) {
      return CommandGroup.empty();
    }
    if (entry instanceof CommandGroup group) {
      return group;
    }
    throw new LeafCollisionException(
        new LeafCollision(operation, path.prefix(depth + 1), path.suffix(depth + 1)));
  }

  private static void requireNested(CommandPath path) {
    if (path.isTopLevel()) {
      throw new IllegalArgumentException(
          "Nested operation needs at least two path segments, got `" + path + "`");
    }
  }
}
