package com.acme.commands.storage;

import com.acme.commands.core.RegistryException;

public class TableAlreadyExistsException extends RegistryException {
  public TableAlreadyExistsException(String tableName) {
    super("A command table named '" + tableName + "' already exists");
  }
}
