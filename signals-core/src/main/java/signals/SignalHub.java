package signals;

import signals.dispatch.DispatchObserver;
import signals.dispatch.RedispatchPolicy;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Type-keyed registry holding one instance per signal type.
 *
 * <p>Instances are created on first lookup through the type's no-arg constructor and kept
 * until {@link #clear()}. Pass a hub by reference to the subsystems that need it;
 * {@link Signals} offers a process-wide default for code that does not.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SignalHub hub = SignalHub.builder()
 *     .redispatchPolicy(RedispatchPolicy.RESTART)
 *     .dispatchObserver(new LoggingDispatchObserver())
 *     .build();
 *
 * hub.get(PlayerDied.class).addListener(player -> respawn(player));
 * hub.get(PlayerDied.class).dispatch(player);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Confine a hub and its signals to one logical thread. Only the
 * dispatch observer may be swapped from another thread.
 *
 * @see Signal
 * @see Signals
 */
public final class SignalHub {
  private static final Logger logger = Logger.getLogger(SignalHub.class.getName());

  private final Map<Class<?>, Signal> signals = new LinkedHashMap<>();
  private final RedispatchPolicy redispatchPolicy;
  private volatile DispatchObserver dispatchObserver;

  /**
   * Creates a hub with {@link RedispatchPolicy#REJECT} and no observer.
   */
  public SignalHub() {
    this(new Builder());
  }

  private SignalHub(Builder builder) {
    this.redispatchPolicy = Objects.requireNonNull(builder.redispatchPolicy, "redispatchPolicy");
    this.dispatchObserver = builder.dispatchObserver;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the instance of {@code type}, creating and caching it on first access.
   *
   * @param type concrete signal class with a no-arg constructor
   * @return the single instance of {@code type} in this hub
   * @throws SignalConfigurationException if the type cannot be instantiated
   */
  public <T extends Signal> T get(Class<T> type) {
    return type.cast(resolve(type));
  }

  /**
   * Untyped variant of {@link #get(Class)} for types that come from configuration
   * or annotations.
   *
   * @param type the signal class
   * @return the single instance of {@code type} in this hub
   * @throws SignalConfigurationException if {@code type} is not a concrete {@link Signal}
   *     with a usable no-arg constructor
   */
  public Signal resolve(Class<?> type) {
    Objects.requireNonNull(type, "type");
    Signal signal = signals.get(type);
    if (signal != null) {
      return signal;
    }
    return bind(type);
  }

  public boolean contains(Class<?> type) {
    return signals.containsKey(type);
  }

  /**
   * Returns the number of signal types bound in this hub.
   */
  public int count() {
    return signals.size();
  }

  /**
   * Returns the bound signal types in binding order.
   */
  public Set<Class<?>> signalTypes() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(signals.keySet()));
  }

  /**
   * Drops every bound instance. The instances keep their listeners and state; code that
   * still holds one keeps a detached copy, and the next lookup creates a new instance.
   */
  public void clear() {
    if (!signals.isEmpty()) {
      logger.log(Level.FINE, "Clearing {0} signal(s)", signals.size());
    }
    signals.clear();
  }

  public RedispatchPolicy redispatchPolicy() {
    return redispatchPolicy;
  }

  /**
   * Returns the observer notified around every dispatch, or {@code null}.
   */
  public DispatchObserver dispatchObserver() {
    return dispatchObserver;
  }

  /**
   * Installs the observer notified around every dispatch of this hub's signals.
   *
   * @param dispatchObserver the observer, or {@code null} to disable observation
   */
  public void setDispatchObserver(DispatchObserver dispatchObserver) {
    this.dispatchObserver = dispatchObserver;
  }

  private Signal bind(Class<?> type) {
    Signal signal = instantiate(type);
    if (signal instanceof AbstractSignal<?> attachable) {
      attachable.attach(this);
    }
    signals.put(type, signal);
    logger.log(Level.FINE, "Bound signal {0}", type.getName());
    return signal;
  }

  private static Signal instantiate(Class<?> type) {
    if (!Signal.class.isAssignableFrom(type)) {
      throw new SignalConfigurationException(type,
          type.getName() + " does not implement " + Signal.class.getName());
    }
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new SignalConfigurationException(type,
          "Signal type " + type.getName() + " is abstract and cannot be instantiated");
    }
    Constructor<?> constructor;
    try {
      constructor = type.getDeclaredConstructor();
    } catch (NoSuchMethodException e) {
      throw new SignalConfigurationException(type,
          "Signal type " + type.getName() + " must declare a no-arg constructor", e);
    }
    constructor.trySetAccessible();
    try {
      return (Signal) constructor.newInstance();
    } catch (InvocationTargetException e) {
      throw new SignalConfigurationException(type,
          "Constructor of signal type " + type.getName() + " failed", e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new SignalConfigurationException(type,
          "Failed to instantiate signal type " + type.getName(), e);
    }
  }

  /**
   * Builder for {@link SignalHub}.
   */
  public static final class Builder {
    private RedispatchPolicy redispatchPolicy = RedispatchPolicy.REJECT;
    private DispatchObserver dispatchObserver;

    private Builder() {}

    /**
     * Sets what signals bound by this hub do when a dispatch starts while another is
     * still in flight.
     *
     * <p>Optional. Defaults to {@link RedispatchPolicy#REJECT}.
     *
     * @param redispatchPolicy the policy
     * @return this builder
     */
    public Builder redispatchPolicy(RedispatchPolicy redispatchPolicy) {
      this.redispatchPolicy = redispatchPolicy;
      return this;
    }

    /**
     * Sets the initial dispatch observer.
     *
     * <p>Optional. Defaults to none.
     *
     * @param dispatchObserver the observer
     * @return this builder
     */
    public Builder dispatchObserver(DispatchObserver dispatchObserver) {
      this.dispatchObserver = dispatchObserver;
      return this;
    }

    public SignalHub build() {
      return new SignalHub(this);
    }
  }
}
