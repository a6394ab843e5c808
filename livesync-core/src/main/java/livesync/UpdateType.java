package livesync;

/**
 * Kind of change a row makes to the windowed store, and the flush kind that delivers it.
 */
public enum UpdateType {
  /** The row's index is new and extends the tail. Delivered by streaming. */
  APPEND,
  /** The row overwrites an index already seen. Delivered by patching, or streaming when the
   * index has left the sink's window. */
  CORRECTION
}
