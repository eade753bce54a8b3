package com.acme.commands.registry;

import java.util.List;
import java.util.Objects;

/**
 * Location of an entry: a top-level name followed by zero or more nested group names.
 *
 * <p>Example: {@code ["admin", "ban"]} addresses the {@code ban} entry inside the {@code admin}
 * group.
 */
public record CommandPath(List<String> segments) {

  public CommandPath {
    Objects.requireNonNull(segments, "segments");
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("Command path must have at least one segment");
    }
    for (String segment : segments) {
      if (segment == null || segment.isEmpty()) {
        throw new IllegalArgumentException("Command path segments must be non-empty: " + segments);
      }
    }
    segments = List.copyOf(segments);
  }

  public static CommandPath of(String... segments) {
    return new CommandPath(List.of(segments));
  }

  public static CommandPath of(List<String> segments) {
    return new CommandPath(segments);
  }

  /** The top-level name. */
  public String head() {
    return segments.get(0);
  }

  public String segment(int index) {
    return segments.get(index);
  }

  public int size() {
    return segments.size();
  }

  public boolean isTopLevel() {
    return segments.size() == 1;
  }

  public boolean isLast(int index) {
    return index == segments.size() - 1;
  }

  /** The first {@code length} segments. */
  public List<String> prefix(int length) {
    return segments.subList(0, length);
  }

  /** Segments from {@code from} (inclusive) to the end. */
  public List<String> suffix(int from) {
    return segments.subList(from, segments.size());
  }

  @Override
  public String toString() {
    return String.join(" ", segments);
  }
}
