package signals.spring.boot;

import signals.Signal;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a listener of one or more signals.
 *
 * <p>The bean must implement the listener type of every named signal: {@link Runnable}
 * for a {@code VoidSignal}, {@code Consumer<A>} for a {@code UnarySignal<A>}, and so on.
 *
 * <pre>{@code
 * @Component
 * @SignalListener(ScoreChanged.class)
 * public class ScoreBoard implements Consumer<Integer> {
 *   public void accept(Integer score) { ... }
 * }
 * }</pre>
 *
 * <p>Listeners are appended to the hub's signal instance sorted by {@code @Order}, with
 * unordered beans following in registration order.
 *
 * @see SignalListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SignalListener {

    /**
     * Signal types the bean listens to.
     */
    Class<? extends Signal>[] value();
}
