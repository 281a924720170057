package signals.dispatch;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reentrant state machine that walks a {@link Dispatchable} exactly once per dispatch.
 *
 * <p>Listener code may call back into the core while it is being invoked:
 * <ul>
 *   <li>{@link #pause()} suspends after the current listener; the call stack unwinds to
 *       whoever started or resumed the dispatch, and {@link #resume()} continues at the
 *       next index</li>
 *   <li>{@link #consume()} aborts the remaining listeners</li>
 *   <li>inserting or removing listeners shifts the cursor through
 *       {@link #onListenerInsertedAt(int)} / {@link #onListenerRemovedAt(int)}, so no
 *       listener is skipped or invoked twice</li>
 * </ul>
 *
 * <p>The loop is iterative: a dispatch adds one stack frame regardless of the number of
 * listeners.
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. All calls for one instance must come from the same logical thread.
 *
 * <h2>Failures</h2>
 * <p>Exceptions thrown by a listener propagate to the caller of {@link #startDispatch()}
 * or {@link #resume()} and leave the state as it was at the time of the failure
 * (usually {@link DispatchState#RUNNING}). Use {@link #reset()} to recover.
 */
public final class DispatchCore {
  private static final Logger logger = Logger.getLogger(DispatchCore.class.getName());

  private final Dispatchable target;
  private RedispatchPolicy redispatchPolicy;
  private int currentIndex;
  private DispatchState state = DispatchState.IDLE;

  public DispatchCore(Dispatchable target) {
    this(target, RedispatchPolicy.REJECT);
  }

  public DispatchCore(Dispatchable target, RedispatchPolicy redispatchPolicy) {
    this.target = Objects.requireNonNull(target, "target");
    this.redispatchPolicy = Objects.requireNonNull(redispatchPolicy, "redispatchPolicy");
  }

  /**
   * Starts a new dispatch at index 0 and runs until completion, pause or consume.
   *
   * @throws IllegalDispatchStateException if a dispatch is RUNNING or PAUSED and the
   *     policy is {@link RedispatchPolicy#REJECT}
   */
  public void startDispatch() {
    checkStart();
    if (isInFlight()) {
      logger.log(Level.WARNING, "Abandoning {0} dispatch of {1} at index {2}",
          new Object[] {state, target, currentIndex});
    }
    currentIndex = 0;
    state = DispatchState.RUNNING;
    run();
  }

  /**
   * Fails fast when {@link #startDispatch()} would be rejected, so callers can check
   * before touching state of their own (such as dispatch arguments).
   *
   * @throws IllegalDispatchStateException if a dispatch is in flight and the policy is
   *     {@link RedispatchPolicy#REJECT}
   */
  public void checkStart() {
    if (isInFlight() && redispatchPolicy == RedispatchPolicy.REJECT) {
      throw new IllegalDispatchStateException(state, currentIndex);
    }
  }

  /**
   * Returns {@code true} while a dispatch is RUNNING or PAUSED.
   */
  public boolean isInFlight() {
    return state == DispatchState.RUNNING || state == DispatchState.PAUSED;
  }

  /**
   * Suspends the running dispatch once the current listener returns. No-op unless RUNNING.
   */
  public void pause() {
    if (state == DispatchState.RUNNING) {
      state = DispatchState.PAUSED;
    }
  }

  /**
   * Resumes a paused dispatch at the listener after the one that paused it.
   * No-op unless PAUSED.
   */
  public void resume() {
    if (state != DispatchState.PAUSED) {
      return;
    }
    currentIndex++;
    state = DispatchState.RUNNING;
    run();
  }

  /**
   * Aborts the running dispatch once the current listener returns. No-op unless RUNNING.
   */
  public void consume() {
    if (state == DispatchState.RUNNING) {
      state = DispatchState.CONSUMED;
    }
  }

  /**
   * Forces the core back to IDLE at index 0, e.g. after a listener threw.
   */
  public void reset() {
    currentIndex = 0;
    state = DispatchState.IDLE;
  }

  /**
   * Must be called after a listener was inserted at {@code index}.
   */
  public void onListenerInsertedAt(int index) {
    if (state == DispatchState.IDLE) {
      return;
    }
    if (index <= currentIndex) {
      currentIndex++;
    }
  }

  /**
   * Must be called after the listener at {@code index} was removed.
   */
  public void onListenerRemovedAt(int index) {
    if (state == DispatchState.IDLE) {
      return;
    }
    if (index <= currentIndex) {
      currentIndex--;
    }
  }

  public DispatchState state() {
    return state;
  }

  public int currentIndex() {
    return currentIndex;
  }

  public RedispatchPolicy redispatchPolicy() {
    return redispatchPolicy;
  }

  public void setRedispatchPolicy(RedispatchPolicy redispatchPolicy) {
    this.redispatchPolicy = Objects.requireNonNull(redispatchPolicy, "redispatchPolicy");
  }

  private void run() {
    while (true) {
      if (currentIndex >= target.listenerCount()) {
        state = DispatchState.IDLE;
        return;
      }
      target.invoke(currentIndex);
      // paused, consumed, or finished by a nested resume
      if (state != DispatchState.RUNNING) {
        return;
      }
      currentIndex++;
    }
  }
}
