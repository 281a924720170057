package signals;

import signals.dispatch.CallerContext;
import signals.dispatch.DispatchCore;
import signals.dispatch.DispatchObserver;
import signals.dispatch.DispatchState;
import signals.dispatch.Dispatchable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener storage and dispatch plumbing shared by the signal variants.
 *
 * <p>Listeners are kept in registration order; the same listener can be registered only
 * once. Every structural change is reported to the {@link DispatchCore}, which makes it
 * safe to add or remove listeners (including the one being invoked) during a dispatch:
 * <ul>
 *   <li>a listener appended at the end is reached by the dispatch underway</li>
 *   <li>a listener inserted at or before the current position is not</li>
 *   <li>removing a listener never skips the next one or repeats the current one</li>
 * </ul>
 *
 * <p>Instances bound by a {@link SignalHub} report dispatches to that hub's
 * {@link DispatchObserver} and use its {@link signals.dispatch.RedispatchPolicy}.
 * Unbound instances use the {@linkplain Signals#defaultHub() default hub}'s observer.
 *
 * @param <L> listener type
 */
public abstract class AbstractSignal<L> implements Signal {
  private static final Logger logger = Logger.getLogger(AbstractSignal.class.getName());

  private final Class<?> listenerType;
  private final List<L> listeners = new ArrayList<>();
  private final DispatchCore core = new DispatchCore(new ListenerSequence());
  private SignalHub hub;

  protected AbstractSignal(Class<?> listenerType) {
    this.listenerType = Objects.requireNonNull(listenerType, "listenerType");
  }

  @Override
  public final String id() {
    return getClass().getName();
  }

  @Override
  public final int listenerCount() {
    return listeners.size();
  }

  @Override
  public final DispatchState state() {
    return core.state();
  }

  /**
   * Returns the raw type every listener of this signal implements.
   */
  public final Class<?> listenerType() {
    return listenerType;
  }

  /**
   * Appends a listener.
   *
   * @param listener the listener
   * @return {@code false} if the listener is already registered
   */
  public final boolean addListener(L listener) {
    Objects.requireNonNull(listener, "listener");
    if (listeners.contains(listener)) {
      return false;
    }
    listeners.add(listener);
    core.onListenerInsertedAt(listeners.size() - 1);
    return true;
  }

  /**
   * Inserts a listener at {@code index}, shifting later listeners back by one.
   *
   * @param index position, {@code 0 <= index <= listenerCount()}
   * @param listener the listener
   * @return {@code false} if the listener is already registered
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public final boolean insertListener(int index, L listener) {
    Objects.requireNonNull(listener, "listener");
    Objects.checkIndex(index, listeners.size() + 1);
    if (listeners.contains(listener)) {
      return false;
    }
    listeners.add(index, listener);
    core.onListenerInsertedAt(index);
    return true;
  }

  /**
   * Removes a listener.
   *
   * @param listener the listener
   * @return {@code false} if the listener was not registered
   */
  public final boolean removeListener(L listener) {
    int index = listeners.indexOf(listener);
    if (index < 0) {
      return false;
    }
    listeners.remove(index);
    core.onListenerRemovedAt(index);
    return true;
  }

  public final boolean hasListener(L listener) {
    return listeners.contains(listener);
  }

  @Override
  public final void clear() {
    for (int i = listeners.size() - 1; i >= 0; i--) {
      listeners.remove(i);
      core.onListenerRemovedAt(i);
    }
  }

  @Override
  public final void pause() {
    core.pause();
  }

  @Override
  public final void resume() {
    core.resume();
  }

  @Override
  public final void consume() {
    core.consume();
  }

  @Override
  public final void reset() {
    core.reset();
  }

  /**
   * Starts a dispatch. Variants bind their arguments in {@code bindArguments}, which
   * runs only once the dispatch is known to start, so a rejected dispatch leaves the
   * arguments of a paused one intact.
   *
   * @param bindArguments stores the dispatch arguments for {@link #invoke(Object)}
   * @throws signals.dispatch.IllegalDispatchStateException if a dispatch is in flight and
   *     the redispatch policy rejects it
   */
  protected final void startDispatch(Runnable bindArguments) {
    core.checkStart();
    bindArguments.run();

    DispatchObserver observer = hub().dispatchObserver();
    if (observer == null) {
      core.startDispatch();
      return;
    }
    CallerContext caller = CallerContext.capture(AbstractSignal.class::isAssignableFrom);
    notifyBefore(observer, caller);
    try {
      core.startDispatch();
    } catch (RuntimeException | Error e) {
      notifyAfter(observer, caller, e);
      throw e;
    }
    notifyAfter(observer, caller, null);
  }

  /**
   * Invokes one listener with the arguments of the current dispatch.
   */
  protected abstract void invoke(L listener);

  final void attach(SignalHub hub) {
    this.hub = hub;
    core.setRedispatchPolicy(hub.redispatchPolicy());
  }

  final int currentIndex() {
    return core.currentIndex();
  }

  private SignalHub hub() {
    return hub != null ? hub : Signals.defaultHub();
  }

  private void notifyBefore(DispatchObserver observer, CallerContext caller) {
    try {
      observer.beforeDispatch(this, caller);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "DispatchObserver beforeDispatch failed for " + id(), e);
    }
  }

  private void notifyAfter(DispatchObserver observer, CallerContext caller, Throwable error) {
    try {
      observer.afterDispatch(this, caller, error);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "DispatchObserver afterDispatch failed for " + id(), e);
    }
  }

  @Override
  public String toString() {
    return "Signal " + getClass().getSimpleName() + ": " + listeners.size()
        + " listeners, state " + core.state() + ", index " + core.currentIndex();
  }

  private final class ListenerSequence implements Dispatchable {
    @Override
    public int listenerCount() {
      return listeners.size();
    }

    @Override
    public void invoke(int index) {
      AbstractSignal.this.invoke(listeners.get(index));
    }

    @Override
    public String toString() {
      return id();
    }
  }
}
