package signals;

import signals.dispatch.DispatchObserver;

/**
 * Process-wide default {@link SignalHub}.
 *
 * <p>Convenient for small applications and scripts. Larger applications should create
 * their own hub and hand it to the components that need it.
 */
public final class Signals {
  private static final SignalHub DEFAULT_HUB = new SignalHub();

  private Signals() {}

  public static SignalHub defaultHub() {
    return DEFAULT_HUB;
  }

  /**
   * Returns the default hub's instance of {@code type}, creating it on first access.
   *
   * @see SignalHub#get(Class)
   */
  public static <T extends Signal> T get(Class<T> type) {
    return DEFAULT_HUB.get(type);
  }

  public static int count() {
    return DEFAULT_HUB.count();
  }

  /**
   * Drops every signal of the default hub and removes its dispatch observer.
   */
  public static void clear() {
    DEFAULT_HUB.clear();
    DEFAULT_HUB.setDispatchObserver(null);
  }

  /**
   * Installs the default hub's dispatch observer; {@code null} disables it.
   */
  public static void setDispatchObserver(DispatchObserver dispatchObserver) {
    DEFAULT_HUB.setDispatchObserver(dispatchObserver);
  }
}
