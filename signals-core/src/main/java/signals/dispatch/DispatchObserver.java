package signals.dispatch;

import signals.Signal;

/**
 * Diagnostic hook invoked around every signal dispatch.
 *
 * <p>Observers see a dispatch but cannot change it: exceptions thrown from either
 * callback are logged and dropped. A dispatch that pauses or is consumed still counts
 * as returned; {@code afterDispatch} runs when the call to {@code dispatch(..)} returns.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * hub.setDispatchObserver(DispatchObserver.before((signal, caller) ->
 *     trace.add(signal.id() + " from " + caller)));
 *
 * // disable
 * hub.setDispatchObserver(null);
 * }</pre>
 *
 * @see signals.SignalHub#setDispatchObserver(DispatchObserver)
 * @see LoggingDispatchObserver
 */
public interface DispatchObserver {

  /**
   * Called before the first listener is invoked.
   *
   * @param signal the signal being dispatched
   * @param caller the code that called {@code dispatch(..)}
   */
  default void beforeDispatch(Signal signal, CallerContext caller) {
  }

  /**
   * Called when {@code dispatch(..)} returns or throws.
   *
   * @param signal the dispatched signal
   * @param caller the code that called {@code dispatch(..)}
   * @param error null on success, the listener failure otherwise
   */
  default void afterDispatch(Signal signal, CallerContext caller, Throwable error) {
  }

  /**
   * Creates an observer with only a beforeDispatch callback.
   */
  static DispatchObserver before(BeforeHook hook) {
    return new DispatchObserver() {
      @Override
      public void beforeDispatch(Signal signal, CallerContext caller) {
        hook.accept(signal, caller);
      }
    };
  }

  /**
   * Creates an observer with only an afterDispatch callback.
   */
  static DispatchObserver after(AfterHook hook) {
    return new DispatchObserver() {
      @Override
      public void afterDispatch(Signal signal, CallerContext caller, Throwable error) {
        hook.accept(signal, caller, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(Signal signal, CallerContext caller);
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(Signal signal, CallerContext caller, Throwable error);
  }
}
