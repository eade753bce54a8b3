package com.acme.commands.spi;

import com.acme.commands.registry.LeafCollision;
import java.util.Optional;

/** Outcome of a registry write. */
public record StorageResult(Status status, String error, LeafCollision collision) {

  public enum Status {
    OK,
    ERROR
  }

  private static final StorageResult OK = new StorageResult(Status.OK, null, null);

  public static StorageResult ok() {
    return OK;
  }

  public static StorageResult error(LeafCollision collision) {
    return new StorageResult(Status.ERROR, collision.describe(), collision);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public boolean isError() {
    return status == Status.ERROR;
  }

  public Optional<LeafCollision> leafCollision() {
    return Optional.ofNullable(collision);
  }
}
