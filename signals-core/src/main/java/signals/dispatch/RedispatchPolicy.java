package signals.dispatch;

/**
 * What a signal does when a dispatch starts while the previous one is still
 * {@link DispatchState#RUNNING} or {@link DispatchState#PAUSED}.
 *
 * <p>A {@link DispatchState#CONSUMED} or {@link DispatchState#IDLE} signal always
 * starts a fresh dispatch.
 */
public enum RedispatchPolicy {
  /** Throw {@link IllegalDispatchStateException}; the in-flight dispatch is left untouched. */
  REJECT,
  /** Log a warning, abandon the in-flight dispatch and start over at index 0. */
  RESTART
}
