package signals;

/**
 * Thrown when a signal type cannot be bound: it does not implement {@link Signal},
 * is abstract, has no no-arg constructor, or its constructor fails.
 *
 * <p>The failure affects only the lookup that raised it; nothing is cached for the type.
 */
public class SignalConfigurationException extends RuntimeException {

  private final Class<?> signalType;

  public SignalConfigurationException(Class<?> signalType, String message) {
    super(message);
    this.signalType = signalType;
  }

  public SignalConfigurationException(Class<?> signalType, String message, Throwable cause) {
    super(message, cause);
    this.signalType = signalType;
  }

  public Class<?> signalType() {
    return signalType;
  }
}
