package io.restoreassist.sync.sync;

/** Declaration order is dequeue order: HIGH before NORMAL. */
public enum SyncPriority {
  HIGH,
  NORMAL;

  public SyncPriority max(SyncPriority other) {
    return this.ordinal() <= other.ordinal() ? this : other;
  }
}
