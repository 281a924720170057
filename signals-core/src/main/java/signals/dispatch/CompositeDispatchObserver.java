package signals.dispatch;

import signals.Signal;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans a dispatch out to several observers.
 *
 * <p>{@code beforeDispatch} runs in list order, {@code afterDispatch} in reverse order.
 * A failing observer is logged and does not stop the others.
 */
public final class CompositeDispatchObserver implements DispatchObserver {
  private static final Logger logger = Logger.getLogger(CompositeDispatchObserver.class.getName());

  private final List<DispatchObserver> observers;

  public CompositeDispatchObserver(List<? extends DispatchObserver> observers) {
    this.observers = List.copyOf(observers);
  }

  public List<DispatchObserver> observers() {
    return observers;
  }

  @Override
  public void beforeDispatch(Signal signal, CallerContext caller) {
    for (DispatchObserver observer : observers) {
      try {
        observer.beforeDispatch(signal, caller);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "DispatchObserver beforeDispatch failed", e);
      }
    }
  }

  @Override
  public void afterDispatch(Signal signal, CallerContext caller, Throwable error) {
    for (int i = observers.size() - 1; i >= 0; i--) {
      try {
        observers.get(i).afterDispatch(signal, caller, error);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "DispatchObserver afterDispatch failed", e);
      }
    }
  }
}
