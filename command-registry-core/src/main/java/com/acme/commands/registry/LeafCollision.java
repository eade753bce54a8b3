package com.acme.commands.registry;

import java.util.List;

/**
 * Details of a path that tried to descend through a terminal command.
 *
 * @param operation the attempted operation, {@code "add"} or {@code "remove"}
 * @param blockingPath path of the existing command; its first element is the top-level name
 * @param subpath the segments that could not be placed below it
 */
public record LeafCollision(String operation, List<String> blockingPath, List<String> subpath) {

  public LeafCollision {
    blockingPath = List.copyOf(blockingPath);
    subpath = List.copyOf(subpath);
  }

  /** The top-level name under which the collision happened. */
  public String commandName() {
    return blockingPath.get(0);
  }

  public String describe() {
    String kind = blockingPath.size() == 1 ? "a top-level command" : "a command";
    return String.format(
        "command `%s` is %s, cannot %s subcommand at `%s`",
        String.join(" ", blockingPath), kind, operation, String.join(" ", subpath));
  }
}
