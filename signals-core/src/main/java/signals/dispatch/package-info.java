/**
 * Dispatch state machine and dispatch observation.
 *
 * <p>{@link signals.dispatch.DispatchCore} walks a {@link signals.dispatch.Dispatchable}
 * listener sequence and supports pause/resume, consume, and listener mutation from inside
 * a listener. {@link signals.dispatch.DispatchObserver} receives a callback around every
 * dispatch for tracing.
 *
 * @see signals.dispatch.DispatchCore
 * @see signals.dispatch.DispatchState
 * @see signals.dispatch.RedispatchPolicy
 * @see signals.dispatch.DispatchObserver
 */
package signals.dispatch;
