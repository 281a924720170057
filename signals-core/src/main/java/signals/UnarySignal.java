package signals;

import java.util.function.Consumer;

/**
 * Signal carrying one argument; listeners are {@link Consumer}s.
 *
 * <pre>{@code
 * public class ScoreChanged extends UnarySignal<Integer> {}
 * }</pre>
 *
 * @param <A> argument type
 */
public abstract class UnarySignal<A> extends AbstractSignal<Consumer<A>> {
  private A first;

  protected UnarySignal() {
    super(Consumer.class);
  }

  /**
   * Invokes all listeners in registration order with {@code first}. The argument is
   * kept until the next dispatch, so a resumed dispatch delivers the same value.
   */
  public void dispatch(A first) {
    startDispatch(() -> this.first = first);
  }

  @Override
  protected final void invoke(Consumer<A> listener) {
    listener.accept(first);
  }
}
