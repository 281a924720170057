package signals;

/**
 * Signal without arguments; listeners are {@link Runnable}s.
 *
 * <pre>{@code
 * public class GamePaused extends VoidSignal {}
 * }</pre>
 */
public abstract class VoidSignal extends AbstractSignal<Runnable> {

  protected VoidSignal() {
    super(Runnable.class);
  }

  /**
   * Invokes all listeners in registration order.
   */
  public void dispatch() {
    startDispatch(() -> { });
  }

  @Override
  protected final void invoke(Runnable listener) {
    listener.run();
  }
}
