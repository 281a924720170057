package signals.dispatch;

/**
 * Listener storage driven by a {@link DispatchCore}.
 *
 * <p>Implementations must report every structural change made while a dispatch
 * is in progress through {@link DispatchCore#onListenerInsertedAt(int)} and
 * {@link DispatchCore#onListenerRemovedAt(int)}.
 */
public interface Dispatchable {

  /**
   * Returns the current number of listeners. Read before every invocation, so
   * the value may change between reads when listeners are added or removed.
   */
  int listenerCount();

  /**
   * Invokes the listener at {@code index}.
   *
   * @param index position in the listener sequence, {@code 0 <= index < listenerCount()}
   */
  void invoke(int index);
}
