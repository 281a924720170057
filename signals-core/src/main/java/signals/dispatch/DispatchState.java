package signals.dispatch;

/**
 * Dispatch lifecycle of a single signal instance.
 *
 * <p>Transitions:
 * <ul>
 *   <li>IDLE, CONSUMED → RUNNING on dispatch</li>
 *   <li>RUNNING → PAUSED on {@link DispatchCore#pause()}</li>
 *   <li>PAUSED → RUNNING on {@link DispatchCore#resume()}</li>
 *   <li>RUNNING → CONSUMED on {@link DispatchCore#consume()}</li>
 *   <li>RUNNING → IDLE when the last listener returns</li>
 * </ul>
 */
public enum DispatchState {
  /** Never dispatched, or the last dispatch ran to completion. */
  IDLE,
  /** Invoking the listener at the current index. */
  RUNNING,
  /** Suspended after the listener at the current index; resumes at the next one. */
  PAUSED,
  /** Aborted at the current index; stays here until the next dispatch. */
  CONSUMED
}
