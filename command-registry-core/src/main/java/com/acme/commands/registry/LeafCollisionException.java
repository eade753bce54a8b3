package com.acme.commands.registry;

import com.acme.commands.core.RegistryException;

/** Raised when a path traverses an existing command as if it were a group. */
public class LeafCollisionException extends RegistryException {
  private final LeafCollision collision;

  public LeafCollisionException(LeafCollision collision) {
    super(collision.describe());
    this.collision = collision;
  }

  public LeafCollision getCollision() {
    return collision;
  }
}
