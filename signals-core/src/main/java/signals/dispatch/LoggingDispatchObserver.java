package signals.dispatch;

import signals.Signal;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs every dispatch through {@code java.util.logging}.
 *
 * <p>Dispatches are logged at {@code FINE} under the logger
 * {@code signals.dispatch.LoggingDispatchObserver}; listener failures at {@code WARNING}.
 */
public final class LoggingDispatchObserver implements DispatchObserver {
  private static final Logger logger = Logger.getLogger(LoggingDispatchObserver.class.getName());

  @Override
  public void beforeDispatch(Signal signal, CallerContext caller) {
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Dispatching {0} to {1} listener(s) from {2}",
          new Object[] {signal.id(), signal.listenerCount(), caller});
    }
  }

  @Override
  public void afterDispatch(Signal signal, CallerContext caller, Throwable error) {
    if (error != null) {
      logger.log(Level.WARNING, "Dispatch of " + signal.id() + " from " + caller
          + " failed in state " + signal.state(), error);
    } else if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Dispatch of {0} returned in state {1}",
          new Object[] {signal.id(), signal.state()});
    }
  }
}
