package com.acme.commands.storage;

/** How nested writes to the same top-level name interact. */
public enum WriteConsistency {
  /**
   * Read the top-level entry, compute the new one, write it back, with nothing in between. Two
   * concurrent nested writes under the same top-level name may lose one of the updates.
   */
  UNSYNCHRONIZED,

  /** Nested writes run as one atomic read-modify-write per top-level name. No lost updates. */
  PER_KEY_ATOMIC
}
