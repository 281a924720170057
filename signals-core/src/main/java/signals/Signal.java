package signals;

import signals.dispatch.DispatchState;

/**
 * A named event type with a single dispatch instance per {@link SignalHub}.
 *
 * <p>Registration and dispatch are typed and live on the concrete variants
 * ({@link VoidSignal}, {@link UnarySignal}, {@link BinarySignal}, {@link TernarySignal}).
 * This interface carries the controls that listener code uses on the signal it is
 * being invoked by.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public class LevelLoaded extends UnarySignal<String> {}
 *
 * LevelLoaded loaded = hub.get(LevelLoaded.class);
 * loaded.addListener(level -> {
 *   fadeIn(level, loaded::resume);   // resume later from a callback
 *   loaded.pause();
 * });
 * loaded.dispatch("forest");
 * }</pre>
 *
 * @see AbstractSignal
 * @see SignalHub
 */
public interface Signal {

  /**
   * Stable identifier derived from the signal's type. Used for diagnostics only.
   */
  String id();

  /**
   * Returns the number of registered listeners.
   */
  int listenerCount();

  /**
   * Returns the dispatch state.
   */
  DispatchState state();

  /**
   * Suspends the running dispatch after the current listener returns.
   * No-op unless the signal is {@link DispatchState#RUNNING}.
   */
  void pause();

  /**
   * Continues a paused dispatch at the next listener.
   * No-op unless the signal is {@link DispatchState#PAUSED}.
   */
  void resume();

  /**
   * Stops the running dispatch after the current listener returns; the remaining
   * listeners are not invoked. No-op unless the signal is {@link DispatchState#RUNNING}.
   */
  void consume();

  /**
   * Forces the signal back to {@link DispatchState#IDLE}, e.g. after a listener threw.
   */
  void reset();

  /**
   * Removes all listeners.
   */
  void clear();
}
