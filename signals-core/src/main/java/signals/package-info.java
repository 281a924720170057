/**
 * Root API for signals: an in-process, type-keyed, synchronous event dispatcher.
 *
 * <h2>Core Design</h2>
 * <p>A signal is a class. Each {@linkplain signals.SignalHub hub} holds at most one
 * instance per signal class and creates it on first lookup. Listeners are registered on
 * that instance and invoked in registration order when it is dispatched. Listener code can
 * {@linkplain signals.Signal#pause() pause} the dispatch and
 * {@linkplain signals.Signal#resume() resume} it later,
 * {@linkplain signals.Signal#consume() consume} it, or add and remove listeners, including
 * itself, without disturbing the dispatch underway.
 *
 * <p>Everything runs on the caller's thread. Nothing is queued or deferred.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>signals-core</b>: hub, signal variants and the dispatch state machine (zero external deps)</li>
 *   <li><b>signals-spring-boot-starter</b>: hub bean and {@code @SignalListener} registration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * public class DoorOpened extends BinarySignal<String, Boolean> {}
 *
 * SignalHub hub = new SignalHub();
 * DoorOpened doorOpened = hub.get(DoorOpened.class);
 *
 * doorOpened.addListener((door, locked) -> {
 *   if (locked) {
 *     doorOpened.consume();           // nobody after us hears about it
 *   }
 * });
 * doorOpened.addListener((door, locked) -> playSound(door));
 *
 * doorOpened.dispatch("cellar", false);
 * }</pre>
 *
 * @see signals.SignalHub
 * @see signals.Signal
 * @see signals.AbstractSignal
 * @see signals.dispatch.DispatchCore
 */
package signals;
