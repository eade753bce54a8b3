package com.acme.commands.core;

/** Base type for failures raised by the command registry. */
public class RegistryException extends RuntimeException {
  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable e) {
    super(message, e);
  }
}
