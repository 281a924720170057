/**
 * Spring Boot auto-configuration for signals.
 *
 * <p>{@link signals.spring.boot.SignalsAutoConfiguration} creates a {@link signals.SignalHub}
 * bean from {@code signals.*} application properties and clears it when the context closes.
 *
 * <p>Use {@link signals.spring.boot.SignalListener @SignalListener} on bean classes to
 * register signal listeners declaratively.
 *
 * @see signals.spring.boot.SignalsAutoConfiguration
 * @see signals.spring.boot.SignalsProperties
 * @see signals.spring.boot.SignalListener
 * @see signals.spring.boot.SignalListenerRegistrar
 */
package signals.spring.boot;
