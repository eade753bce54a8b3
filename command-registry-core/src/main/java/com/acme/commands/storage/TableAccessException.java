package com.acme.commands.storage;

import com.acme.commands.core.RegistryException;

/** A table was used after being destroyed, or written from a thread that may not write to it. */
public class TableAccessException extends RegistryException {
  public TableAccessException(String message) {
    super(message);
  }
}
