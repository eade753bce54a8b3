package com.acme.commands.registry;

import java.util.Objects;

/**
 * Opaque handle to a registered command handler. The registry stores it verbatim and never looks
 * inside it.
 */
public record CommandRef(Object handler) implements CommandEntry {

  public CommandRef {
    Objects.requireNonNull(handler, "handler");
  }

  public static CommandRef of(Object handler) {
    return new CommandRef(handler);
  }
}
